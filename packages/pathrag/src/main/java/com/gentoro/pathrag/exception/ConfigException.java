package com.gentoro.pathrag.exception;

/** Configuration missing, unreadable or invalid. */
public class ConfigException extends PathRagException {
  public ConfigException(String message) {
    super(PathRagErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(PathRagErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
