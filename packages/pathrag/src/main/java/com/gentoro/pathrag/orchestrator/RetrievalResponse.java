package com.gentoro.pathrag.orchestrator;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.gentoro.pathrag.exception.ErrorDetails;
import com.gentoro.pathrag.graph.VersionConstraint;
import com.gentoro.pathrag.retrieval.RankedPath;
import java.util.List;

/**
 * Outcome of {@link RetrievalOrchestrator#answerContext}.
 *
 * @param status OK with paths, EMPTY when nothing survived pruning, ERROR otherwise
 * @param paths best first; empty unless OK
 * @param formattedContext assembled prompt context when formatting was requested
 * @param fromCache whether the result was served from the cache
 * @param error set when status is ERROR
 * @param errorDetails structured description of the failure
 */
public record RetrievalResponse(
    Status status,
    String query,
    VersionConstraint versionConstraint,
    List<RankedPath> paths,
    String formattedContext,
    boolean fromCache,
    RetrievalError error,
    ErrorDetails errorDetails) {

  public enum Status {
    OK,
    EMPTY,
    ERROR
  }

  public RetrievalResponse {
    paths = paths == null ? List.of() : List.copyOf(paths);
  }

  static RetrievalResponse of(
      RetrievalRequest request, List<RankedPath> paths, String formattedContext, boolean cached) {
    return new RetrievalResponse(
        paths.isEmpty() ? Status.EMPTY : Status.OK,
        request.query(),
        request.versionConstraint(),
        paths,
        formattedContext,
        cached,
        null,
        null);
  }

  static RetrievalResponse failure(
      String query,
      VersionConstraint versionConstraint,
      RetrievalError error,
      ErrorDetails details) {
    return new RetrievalResponse(
        Status.ERROR, query, versionConstraint, List.of(), null, false, error, details);
  }

  @JsonIgnore
  public boolean isSuccess() {
    return status != Status.ERROR;
  }
}
