package com.gentoro.pathrag.exception;

/** I/O operation failed (filesystem, classpath, cache blobs). */
public class IoException extends PathRagException {
  public IoException(String message) {
    super(PathRagErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(PathRagErrorCode.IO_ERROR, message, cause);
  }
}
