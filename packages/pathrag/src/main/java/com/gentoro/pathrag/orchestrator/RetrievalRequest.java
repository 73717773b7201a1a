package com.gentoro.pathrag.orchestrator;

import com.gentoro.pathrag.exception.ValidationException;
import com.gentoro.pathrag.graph.VersionConstraint;
import java.time.Duration;

/**
 * Parameters of one {@code answerContext} call.
 *
 * @param query anchor node id, or free text resolved to anchors by the graph store
 * @param maxPaths positive, default {@value #DEFAULT_MAX_PATHS}
 * @param domainFilter optional domain the returned paths must end in
 * @param versionConstraint optional, passed through to the graph store
 * @param formatForOutput return an assembled prompt context in addition to the ranked paths
 * @param timeout optional override of the configured upstream timeout
 */
public record RetrievalRequest(
    String query,
    int maxPaths,
    String domainFilter,
    VersionConstraint versionConstraint,
    boolean formatForOutput,
    Duration timeout) {
  public static final int DEFAULT_MAX_PATHS = 5;

  public RetrievalRequest {
    if (query == null || query.isBlank()) {
      throw new ValidationException("query cannot be empty");
    }
    if (maxPaths <= 0) {
      throw new ValidationException("maxPaths must be positive: " + maxPaths);
    }
    if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
      throw new ValidationException("timeout must be positive: " + timeout);
    }
    query = query.strip();
    if (domainFilter != null && domainFilter.isBlank()) {
      domainFilter = null;
    }
  }

  public static RetrievalRequest of(String query) {
    return builder(query).build();
  }

  public static Builder builder(String query) {
    return new Builder(query);
  }

  public static final class Builder {
    private final String query;
    private int maxPaths = DEFAULT_MAX_PATHS;
    private String domainFilter;
    private VersionConstraint versionConstraint;
    private boolean formatForOutput;
    private Duration timeout;

    private Builder(String query) {
      this.query = query;
    }

    public Builder maxPaths(int maxPaths) {
      this.maxPaths = maxPaths;
      return this;
    }

    public Builder domainFilter(String domainFilter) {
      this.domainFilter = domainFilter;
      return this;
    }

    public Builder versionConstraint(VersionConstraint versionConstraint) {
      this.versionConstraint = versionConstraint;
      return this;
    }

    public Builder formatForOutput(boolean formatForOutput) {
      this.formatForOutput = formatForOutput;
      return this;
    }

    public Builder timeout(Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    public RetrievalRequest build() {
      return new RetrievalRequest(
          query, maxPaths, domainFilter, versionConstraint, formatForOutput, timeout);
    }
  }
}
