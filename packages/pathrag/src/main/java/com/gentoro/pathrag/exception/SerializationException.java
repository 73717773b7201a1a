package com.gentoro.pathrag.exception;

/** JSON/YAML (de)serialization failure. */
public class SerializationException extends PathRagException {
  public SerializationException(String message) {
    super(PathRagErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(PathRagErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
