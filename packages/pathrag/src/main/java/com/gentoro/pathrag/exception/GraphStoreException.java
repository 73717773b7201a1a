package com.gentoro.pathrag.exception;

/** The external graph store is unreachable, errored, or returned data that cannot be read. */
public class GraphStoreException extends PathRagException {
  public GraphStoreException(String message) {
    super(PathRagErrorCode.UPSTREAM_UNAVAILABLE, message);
  }

  public GraphStoreException(String message, Throwable cause) {
    super(PathRagErrorCode.UPSTREAM_UNAVAILABLE, message, cause);
  }
}
