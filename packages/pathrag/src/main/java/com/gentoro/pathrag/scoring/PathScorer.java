package com.gentoro.pathrag.scoring;

import com.gentoro.pathrag.exception.MalformedPathException;
import com.gentoro.pathrag.graph.GraphEdge;
import com.gentoro.pathrag.graph.GraphPath;
import com.gentoro.pathrag.graph.ScoredPath;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Resource-flow reliability of a single path.
 *
 * <p>One unit of resource starts at the source vertex. Walking the edges in order, edge {@code i}
 * moves {@code r(from) * weight * decay^i} into its target and adds the same amount to the path
 * score; an edge whose origin holds no resource contributes nothing. The score is divided by the
 * edge count and clamped to [0,1].
 *
 * <p>Stateless and thread-safe.
 */
public final class PathScorer {
  /** Score of a path with a single vertex. */
  public static final double SINGLE_NODE_SCORE = 0.1;

  /** Numerator of the length-only estimate used when edge data is missing. */
  public static final double LENGTH_ONLY_BASE = 0.3;

  private final double defaultDecayRate;

  public PathScorer(ScoringConfig config) {
    this.defaultDecayRate = config.decayRate();
  }

  public double decayRate() {
    return defaultDecayRate;
  }

  /** Score with the configured decay rate. */
  public ScoredPath score(GraphPath path) {
    return new ScoredPath(path, score(path, defaultDecayRate), defaultDecayRate);
  }

  /**
   * @param path path to score
   * @param decayRate per-hop decay in (0,1]
   * @return reliability in [0,1]
   * @throws MalformedPathException when the edge count does not match the vertex count
   * @throws IllegalArgumentException when the decay rate is outside (0,1]
   */
  public static double score(GraphPath path, double decayRate) {
    checkDecayRate(decayRate);
    if (path.vertexCount() == 1 && path.getEdges().isEmpty()) {
      return SINGLE_NODE_SCORE;
    }
    if (!path.hasEdgeData()) {
      return clamp(LENGTH_ONLY_BASE / Math.max(1, path.vertexCount() - 1));
    }
    if (!path.isWellFormed()) {
      throw new MalformedPathException(
          "Path " + path.joinedNames() + " has mismatched vertices and edges",
          path.vertexCount(),
          path.getEdges().size());
    }
    List<GraphEdge> edges = path.getEdges();
    Map<String, Double> resources = new HashMap<>();
    resources.put(path.source().getId(), 1.0);
    double pathScore = 0.0;
    double decay = 1.0;
    for (GraphEdge edge : edges) {
      Double available = resources.get(edge.getFromKey());
      if (available != null) {
        double flow = available * edge.getWeight() * decay;
        resources.merge(edge.getToKey(), flow, Double::sum);
        pathScore += flow;
      }
      decay *= decayRate;
    }
    return clamp(pathScore / Math.max(1, edges.size()));
  }

  static void checkDecayRate(double decayRate) {
    if (!(decayRate > 0.0 && decayRate <= 1.0)) {
      throw new IllegalArgumentException("decay rate must lie in (0,1]: " + decayRate);
    }
  }

  private static double clamp(double value) {
    if (Double.isNaN(value)) return 0.0;
    return Math.max(0.0, Math.min(1.0, value));
  }
}
