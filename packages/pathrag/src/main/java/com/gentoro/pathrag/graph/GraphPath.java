package com.gentoro.pathrag.graph;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

/**
 * An ordered walk through the graph starting at a source node.
 *
 * <p>A well-formed path has exactly one edge between each pair of consecutive vertices. A path
 * whose edge list is absent ({@link #hasEdgeData()} is false) is still usable; scoring then falls
 * back to a length-only estimate. Instances are immutable.
 */
public final class GraphPath {
  private final List<GraphNode> vertices;
  private final List<GraphEdge> edges;

  public GraphPath(List<GraphNode> vertices, List<GraphEdge> edges) {
    if (vertices == null || vertices.isEmpty()) {
      throw new IllegalArgumentException("A path needs at least one vertex");
    }
    this.vertices = Collections.unmodifiableList(new ArrayList<>(vertices));
    this.edges = edges == null ? null : Collections.unmodifiableList(new ArrayList<>(edges));
  }

  /** Single-vertex path. */
  public static GraphPath of(GraphNode source) {
    return new GraphPath(List.of(source), List.of());
  }

  /** Path whose edges were not supplied by the store. */
  public static GraphPath withoutEdgeData(List<GraphNode> vertices) {
    return new GraphPath(vertices, null);
  }

  public List<GraphNode> getVertices() {
    return vertices;
  }

  /** Edges between consecutive vertices; empty when {@link #hasEdgeData()} is false. */
  public List<GraphEdge> getEdges() {
    return edges == null ? List.of() : edges;
  }

  public boolean hasEdgeData() {
    return edges != null;
  }

  public GraphNode source() {
    return vertices.get(0);
  }

  public GraphNode target() {
    return vertices.get(vertices.size() - 1);
  }

  public int vertexCount() {
    return vertices.size();
  }

  /** Number of hops. */
  public int length() {
    return vertices.size() - 1;
  }

  /**
   * True when the edge count matches the vertex count. Paths without edge data count as
   * well-formed.
   */
  public boolean isWellFormed() {
    return edges == null || edges.size() == vertices.size() - 1;
  }

  /** Node names joined with {@code ->}, used for deterministic ordering and logging. */
  public String joinedNames() {
    return vertices.stream().map(GraphNode::getName).collect(Collectors.joining("->"));
  }

  public List<String> nodeIds() {
    return vertices.stream().map(GraphNode::getId).toList();
  }

  /** Mean confidence over the vertices that declare one. */
  public OptionalDouble meanConfidence() {
    return vertices.stream()
        .map(GraphNode::confidence)
        .filter(OptionalDouble::isPresent)
        .mapToDouble(OptionalDouble::getAsDouble)
        .average();
  }

  /** Newest modification time over all vertices, when any vertex carries one. */
  public Optional<Instant> newestModification() {
    return vertices.stream()
        .map(GraphNode::lastModified)
        .flatMap(Optional::stream)
        .max(Instant::compareTo);
  }

  @Override
  public String toString() {
    return "GraphPath{" + joinedNames() + ", edges=" + (edges == null ? "n/a" : edges.size()) + '}';
  }
}
