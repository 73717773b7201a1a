package com.gentoro.pathrag.retrieval;

import com.gentoro.pathrag.graph.GraphEdge;
import com.gentoro.pathrag.graph.GraphNode;
import com.gentoro.pathrag.graph.GraphPath;
import com.gentoro.pathrag.graph.ScoredPath;
import java.util.List;

/** Renders paths as the text that ends up in a prompt. */
public final class PathFormatter {
  private static final String OBSERVATION_SEPARATOR = "; ";

  private PathFormatter() {}

  /**
   * {@code Alice -[works for]-> Acme -[based in]-> Berlin}; paths without edge data use plain
   * arrows.
   */
  public static String toText(GraphPath path) {
    List<GraphNode> vertices = path.getVertices();
    StringBuilder sb = new StringBuilder(vertices.get(0).getName());
    for (int i = 1; i < vertices.size(); i++) {
      if (path.hasEdgeData() && i - 1 < path.getEdges().size()) {
        GraphEdge edge = path.getEdges().get(i - 1);
        sb.append(" -[").append(edge.getRelation()).append("]-> ");
      } else {
        sb.append(" -> ");
      }
      sb.append(vertices.get(i).getName());
    }
    return sb.toString();
  }

  public static RankedPath toRankedPath(ScoredPath scored) {
    GraphPath path = scored.path();
    return new RankedPath(
        toText(path),
        scored.reliability(),
        path.nodeIds(),
        path.length(),
        path.meanConfidence().orElse(1.0),
        List.copyOf(path.target().getObservations()),
        path.newestModification().orElse(null));
  }

  /** Prompt fragment: the path text followed by the target's observations, if any. */
  public static String toFragment(RankedPath path) {
    if (path.observations() == null || path.observations().isEmpty()) {
      return path.pathText();
    }
    return path.pathText() + " (" + String.join(OBSERVATION_SEPARATOR, path.observations()) + ")";
  }
}
