package com.gentoro.pathrag.exception;

/** Illegal or unexpected state encountered. */
public class StateException extends PathRagException {
  public StateException(String message) {
    super(PathRagErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(PathRagErrorCode.FAILED_PRECONDITION, message, cause);
  }
}
