package com.gentoro.pathrag.graph.store;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.pathrag.exception.ConfigException;
import com.gentoro.pathrag.exception.SerializationException;
import com.gentoro.pathrag.graph.GraphEdge;
import com.gentoro.pathrag.graph.GraphNode;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GraphSeedTest {

  @Test
  void loadsNodesAndEdgesFromClasspath() {
    GraphSeed seed = GraphSeed.load("classpath:graph/test-graph.json");

    List<GraphNode> nodes = seed.toNodes();
    assertEquals(3, nodes.size());
    assertEquals("Acme Corp", nodes.get(1).getName());
    assertEquals("company", nodes.get(1).getType());
    assertTrue(nodes.get(1).getEmbeddingRef().isEmpty());
    assertEquals(0.9, nodes.get(0).confidence().orElseThrow());

    List<GraphEdge> edges = seed.toEdges();
    assertEquals("based in", edges.get(1).getRelation());
    assertEquals("2", edges.get(1).getProperties().get("version"));
  }

  @Test
  void missingWeightDefaultsToOne(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("g.json");
    Files.writeString(
        file,
        "{\"nodes\":[{\"id\":\"a\"},{\"id\":\"b\"}],"
            + "\"edges\":[{\"from\":\"a\",\"to\":\"b\",\"relation\":\"r\"}]}");

    GraphSeed seed = GraphSeed.load(file.toString());

    assertEquals(GraphEdge.DEFAULT_WEIGHT, seed.toEdges().get(0).getWeight());
    assertEquals("a", seed.toNodes().get(0).getName());
  }

  @Test
  void missingLocationIsAConfigurationError() {
    assertThrows(ConfigException.class, () -> GraphSeed.load("classpath:graph/nope.json"));
    assertThrows(ConfigException.class, () -> GraphSeed.load("/definitely/not/here.json"));
  }

  @Test
  void unparsableDocumentIsASerializationError(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("broken.json");
    Files.writeString(file, "{ nodes: [");
    assertThrows(SerializationException.class, () -> GraphSeed.load(file.toString()));
  }
}
