package com.gentoro.pathrag.graph;

import java.util.ArrayList;
import java.util.List;

/** Path builders shared by tests. */
public final class TestGraphs {
  private TestGraphs() {}

  public static GraphNode node(String id) {
    return new GraphNode(id, id, "concept", "test");
  }

  /** n0 -> n1 -> ... -> n{hops}, every edge with the given weight. */
  public static GraphPath chain(int hops, double weight) {
    double[] weights = new double[hops];
    java.util.Arrays.fill(weights, weight);
    return chain(weights);
  }

  public static GraphPath chain(double... weights) {
    List<GraphNode> vertices = new ArrayList<>();
    List<GraphEdge> edges = new ArrayList<>();
    vertices.add(node("n0"));
    for (int i = 0; i < weights.length; i++) {
      vertices.add(node("n" + (i + 1)));
      edges.add(new GraphEdge("n" + i, "n" + (i + 1), "links", weights[i]));
    }
    return new GraphPath(vertices, edges);
  }

  /** Single hop {@code from -> to} with the given weight. */
  public static GraphPath hop(String from, String to, double weight) {
    return new GraphPath(
        List.of(node(from), node(to)), List.of(new GraphEdge(from, to, "links", weight)));
  }
}
