package com.gentoro.pathrag.retrieval;

import com.gentoro.pathrag.graph.GraphPath;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one traversal: either the raw paths (possibly none) or the reason the store could
 * not be queried. "No paths" and "retrieval failed" are different results.
 */
public final class RetrievalResult {
  private final List<GraphPath> paths;
  private final RuntimeException failure;

  private RetrievalResult(List<GraphPath> paths, RuntimeException failure) {
    this.paths = paths;
    this.failure = failure;
  }

  public static RetrievalResult success(List<GraphPath> paths) {
    return new RetrievalResult(List.copyOf(Objects.requireNonNull(paths, "paths")), null);
  }

  public static RetrievalResult failed(RuntimeException failure) {
    return new RetrievalResult(List.of(), Objects.requireNonNull(failure, "failure"));
  }

  public boolean isSuccess() {
    return failure == null;
  }

  /** Paths returned by the store; empty for failures. */
  public List<GraphPath> getPaths() {
    return paths;
  }

  /** Cause of a failed retrieval, {@code null} on success. */
  public RuntimeException getFailure() {
    return failure;
  }

  @Override
  public String toString() {
    return isSuccess()
        ? "RetrievalResult{paths=" + paths.size() + '}'
        : "RetrievalResult{failed=" + failure.getMessage() + '}';
  }
}
