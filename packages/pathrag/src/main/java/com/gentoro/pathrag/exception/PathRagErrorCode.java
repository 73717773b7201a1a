package com.gentoro.pathrag.exception;

/**
 * Canonical error codes for PathRAG. Codes are stable and suitable for logs and for callers that
 * map failures onto their own transport.
 */
public enum PathRagErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,

  // I/O and configuration
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,

  // Retrieval
  UPSTREAM_UNAVAILABLE,
  TIMEOUT,
  MALFORMED_PATH,
}
