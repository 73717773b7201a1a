package com.gentoro.pathrag.graph;

import java.util.Comparator;

/**
 * A path with its resource-flow reliability.
 *
 * @param path the scored path
 * @param reliability score in [0,1]
 * @param decayRate per-hop decay used to produce {@code reliability}
 */
public record ScoredPath(GraphPath path, double reliability, double decayRate) {

  /** Highest reliability first, then shorter paths, then node names in lexicographic order. */
  public static final Comparator<ScoredPath> RANKING =
      Comparator.comparingDouble(ScoredPath::reliability)
          .reversed()
          .thenComparingInt(sp -> sp.path().length())
          .thenComparing(sp -> sp.path().joinedNames());

  public ScoredPath {
    if (path == null) {
      throw new IllegalArgumentException("path cannot be null");
    }
    if (reliability < 0.0 || reliability > 1.0 || Double.isNaN(reliability)) {
      throw new IllegalArgumentException("reliability must lie in [0,1]: " + reliability);
    }
  }
}
