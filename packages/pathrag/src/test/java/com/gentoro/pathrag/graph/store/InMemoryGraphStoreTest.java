package com.gentoro.pathrag.graph.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.pathrag.exception.GraphStoreException;
import com.gentoro.pathrag.exception.StateException;
import com.gentoro.pathrag.graph.GraphEdge;
import com.gentoro.pathrag.graph.GraphNode;
import com.gentoro.pathrag.graph.GraphPath;
import com.gentoro.pathrag.graph.VersionConstraint;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryGraphStoreTest {

  private InMemoryGraphStore store;

  @BeforeEach
  void setUp() {
    store = new InMemoryGraphStore();
    store
        .addNode(new GraphNode("a", "Alpha", "t", "x", Set.of("first letter"), null, Map.of()))
        .addNode(new GraphNode("b", "Beta", "t", "y"))
        .addNode(new GraphNode("c", "Gamma", "t", "x"))
        .addNode(
            new GraphNode(
                "d",
                "Delta",
                "t",
                "y",
                Set.of(),
                null,
                Map.of("version", "3", "createdAt", "2024-06-01T00:00:00Z")))
        .addEdge(new GraphEdge("a", "b", "precedes"))
        .addEdge(new GraphEdge("b", "c", "precedes"))
        .addEdge(new GraphEdge("c", "a", "wraps to"))
        .addEdge(new GraphEdge("a", "d", "skips to", 0.5));
    store.initialize();
  }

  private static List<String> joined(List<GraphPath> paths) {
    return paths.stream().map(GraphPath::joinedNames).toList();
  }

  @Test
  void returnsEverySimplePathUpToDepth() {
    List<GraphPath> paths = store.traverse("a", 2, null, null);
    assertThat(joined(paths))
        .containsExactlyInAnyOrder("Alpha->Beta", "Alpha->Beta->Gamma", "Alpha->Delta");
    assertTrue(paths.stream().allMatch(GraphPath::isWellFormed));
  }

  @Test
  void cyclesDoNotRevisitVertices() {
    List<GraphPath> paths = store.traverse("a", 7, null, null);
    assertThat(joined(paths)).doesNotContain("Alpha->Beta->Gamma->Alpha");
    assertThat(paths).hasSize(3);
  }

  @Test
  void domainFilterAppliesToPathEnd() {
    List<GraphPath> paths = store.traverse("a", 3, "x", null);
    assertThat(joined(paths)).containsExactly("Alpha->Beta->Gamma");
  }

  @Test
  void anchorResolvesByNameAndByQueryTerms() {
    assertThat(store.resolveAnchors("beta")).extracting(GraphNode::getId).containsExactly("b");
    assertThat(store.resolveAnchors("Tell me about the first letter"))
        .extracting(GraphNode::getId)
        .containsExactly("a");
    assertThat(store.traverse("unknown thing", 3, null, null)).isEmpty();
  }

  @Test
  void versionConstraintHidesNewerElements() {
    List<GraphPath> v2 = store.traverse("a", 1, null, VersionConstraint.asOfVersion("2"));
    assertThat(joined(v2)).containsExactly("Alpha->Beta");

    List<GraphPath> v10 = store.traverse("a", 1, null, VersionConstraint.asOfVersion("v10"));
    assertThat(joined(v10)).containsExactlyInAnyOrder("Alpha->Beta", "Alpha->Delta");
  }

  @Test
  void timestampConstraintHidesLaterElements() {
    List<GraphPath> before =
        store.traverse("a", 1, null, VersionConstraint.asOfTimestamp("2024-01-01T00:00:00Z"));
    assertThat(joined(before)).containsExactly("Alpha->Beta");

    assertThrows(
        GraphStoreException.class,
        () -> store.traverse("a", 1, null, VersionConstraint.asOfTimestamp("yesterday")));
  }

  @Test
  void versionsCompareNumerically() {
    assertTrue(InMemoryGraphStore.compareVersions("1.10", "1.9") > 0);
    assertEquals(0, InMemoryGraphStore.compareVersions("v2", "2.0"));
    assertTrue(InMemoryGraphStore.compareVersions("99999999999999999999", "3") > 0);
  }

  @Test
  void edgesNeedKnownEndpoints() {
    assertThrows(StateException.class, () -> store.addEdge(new GraphEdge("a", "zzz", "r")));
  }

  @Test
  void traversalRequiresInitialization() {
    InMemoryGraphStore fresh = new InMemoryGraphStore();
    assertThrows(GraphStoreException.class, () -> fresh.traverse("a", 1, null, null));
  }

  @Test
  void resultCountIsCapped() {
    InMemoryGraphStore capped = new InMemoryGraphStore(2);
    capped
        .addNode(new GraphNode("hub", "Hub", "t", "d"))
        .addNode(new GraphNode("s1", "S1", "t", "d"))
        .addNode(new GraphNode("s2", "S2", "t", "d"))
        .addNode(new GraphNode("s3", "S3", "t", "d"))
        .addEdge(new GraphEdge("hub", "s1", "r"))
        .addEdge(new GraphEdge("hub", "s2", "r"))
        .addEdge(new GraphEdge("hub", "s3", "r"));
    capped.initialize();
    assertThat(capped.traverse("hub", 1, null, null)).hasSize(2);
  }

  @Test
  void seedFileBuildsTheStore() {
    InMemoryGraphStore seeded =
        InMemoryGraphStore.fromSeed(GraphSeed.load("classpath:graph/test-graph.json"), 100);
    seeded.initialize();

    assertEquals(3, seeded.nodeCount());
    List<GraphPath> paths = seeded.traverse("Alice", 2, null, null);
    assertThat(joined(paths)).containsExactly("Alice->Acme Corp", "Alice->Acme Corp->Berlin");
    assertEquals(0.9, paths.get(0).getEdges().get(0).getWeight());
  }
}
