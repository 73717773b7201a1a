package com.gentoro.pathrag.exception;

import java.util.Map;

/**
 * A retrieved path violates the vertex/edge invariant ({@code edges == vertices - 1}) or references
 * vertices that its edges do not connect. Retrieval drops such paths and keeps going.
 */
public class MalformedPathException extends PathRagException {
  public MalformedPathException(String message, int vertexCount, int edgeCount) {
    super(
        PathRagErrorCode.MALFORMED_PATH,
        message,
        Map.of("vertices", vertexCount, "edges", edgeCount));
  }
}
