package com.gentoro.pathrag.retrieval;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.pathrag.graph.GraphEdge;
import com.gentoro.pathrag.graph.GraphNode;
import com.gentoro.pathrag.graph.GraphPath;
import com.gentoro.pathrag.graph.ScoredPath;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class PathFormatterTest {

  private final GraphNode alice =
      new GraphNode(
          "alice",
          "Alice",
          "person",
          "hr",
          Set.of(),
          null,
          Map.of("confidence", 0.8, "updatedAt", "2024-05-01T00:00:00Z"));
  private final GraphNode acme =
      new GraphNode(
          "acme",
          "Acme",
          "company",
          "hr",
          Set.of("Founded 1999"),
          null,
          Map.of("confidence", 0.6, "createdAt", "2024-01-01T00:00:00Z"));

  @Test
  void rendersRelationsBetweenNames() {
    GraphPath path =
        new GraphPath(List.of(alice, acme), List.of(new GraphEdge("alice", "acme", "works for")));
    assertEquals("Alice -[works for]-> Acme", PathFormatter.toText(path));
  }

  @Test
  void pathsWithoutEdgesUsePlainArrows() {
    GraphPath path = GraphPath.withoutEdgeData(List.of(alice, acme));
    assertEquals("Alice -> Acme", PathFormatter.toText(path));
  }

  @Test
  void rankedPathCarriesPathFeatures() {
    GraphPath path =
        new GraphPath(List.of(alice, acme), List.of(new GraphEdge("alice", "acme", "works for")));
    RankedPath ranked = PathFormatter.toRankedPath(new ScoredPath(path, 0.9, 0.85));

    assertEquals(List.of("alice", "acme"), ranked.nodeIds());
    assertEquals(1, ranked.length());
    assertEquals(0.7, ranked.confidence(), 1e-9);
    assertEquals(Instant.parse("2024-05-01T00:00:00Z"), ranked.dataModifiedAt());
    assertEquals("Alice -[works for]-> Acme (Founded 1999)", PathFormatter.toFragment(ranked));
  }
}
