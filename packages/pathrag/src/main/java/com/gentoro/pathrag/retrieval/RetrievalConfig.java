package com.gentoro.pathrag.retrieval;

import com.gentoro.pathrag.exception.ConfigException;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;

/**
 * Traversal and pruning parameters.
 *
 * @param maxDepth hops per traversal, 1-7
 * @param pruningThreshold minimum reliability a path must reach to be kept
 * @param maxPaths default number of paths returned when the caller does not say
 * @param timeout default budget for one graph store call
 */
public record RetrievalConfig(
    int maxDepth, double pruningThreshold, int maxPaths, Duration timeout) {
  public static final int MIN_DEPTH = 1;
  public static final int MAX_DEPTH = 7;

  public RetrievalConfig {
    if (maxDepth < MIN_DEPTH || maxDepth > MAX_DEPTH) {
      throw new IllegalArgumentException("maxDepth must lie in [1,7]: " + maxDepth);
    }
    if (pruningThreshold < 0.0 || pruningThreshold > 1.0 || Double.isNaN(pruningThreshold)) {
      throw new IllegalArgumentException("pruningThreshold must lie in [0,1]: " + pruningThreshold);
    }
    if (maxPaths <= 0) {
      throw new IllegalArgumentException("maxPaths must be positive: " + maxPaths);
    }
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
  }

  public static RetrievalConfig defaults() {
    return new RetrievalConfig(3, 0.01, 5, Duration.ofSeconds(5));
  }

  public static RetrievalConfig from(Configuration cfg) {
    try {
      return new RetrievalConfig(
          cfg.getInt("pathrag.retrieval.maxDepth", 3),
          cfg.getDouble("pathrag.retrieval.pruningThreshold", 0.01),
          cfg.getInt("pathrag.retrieval.maxPaths", 5),
          Duration.ofMillis(cfg.getLong("pathrag.retrieval.timeoutMillis", 5000L)));
    } catch (IllegalArgumentException e) {
      throw new ConfigException("Invalid pathrag.retrieval configuration: " + e.getMessage(), e);
    }
  }
}
