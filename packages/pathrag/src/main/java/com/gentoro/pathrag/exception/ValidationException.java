package com.gentoro.pathrag.exception;

/** Input validation failure or illegal argument. */
public class ValidationException extends PathRagException {
  public ValidationException(String message) {
    super(PathRagErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(PathRagErrorCode.INVALID_ARGUMENT, message, cause);
  }
}
