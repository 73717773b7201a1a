package com.gentoro.pathrag.graph.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.gentoro.pathrag.exception.ConfigException;
import com.gentoro.pathrag.exception.SerializationException;
import com.gentoro.pathrag.graph.GraphEdge;
import com.gentoro.pathrag.graph.GraphNode;
import com.gentoro.pathrag.utility.JacksonUtility;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JSON document describing a graph to load into the {@link InMemoryGraphStore}.
 *
 * <pre>{@code
 * { "nodes": [ {"id": "a", "name": "A", "type": "concept", "domain": "physics",
 *               "observations": ["..."], "metadata": {"confidence": 0.9}} ],
 *   "edges": [ {"from": "a", "to": "b", "relation": "explains", "weight": 0.8} ] }
 * }</pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GraphSeed(List<NodeSeed> nodes, List<EdgeSeed> edges) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record NodeSeed(
      String id,
      String name,
      String type,
      String domain,
      Set<String> observations,
      String embeddingRef,
      Map<String, Object> metadata) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record EdgeSeed(
      String from, String to, String relation, Double weight, Map<String, Object> properties) {}

  public List<GraphNode> toNodes() {
    if (nodes == null) return List.of();
    return nodes.stream()
        .map(
            n ->
                new GraphNode(
                    n.id(),
                    n.name(),
                    n.type(),
                    n.domain(),
                    n.observations(),
                    n.embeddingRef(),
                    n.metadata()))
        .toList();
  }

  public List<GraphEdge> toEdges() {
    if (edges == null) return List.of();
    return edges.stream()
        .map(
            e ->
                new GraphEdge(
                    e.from(),
                    e.to(),
                    e.relation(),
                    e.weight() == null ? GraphEdge.DEFAULT_WEIGHT : e.weight(),
                    e.properties()))
        .toList();
  }

  /**
   * Read a seed from {@code classpath:some/graph.json} or a filesystem path.
   *
   * @throws ConfigException when the location does not exist
   * @throws SerializationException when the document cannot be parsed
   */
  public static GraphSeed load(String location) {
    if (location == null || location.isBlank()) {
      throw new ConfigException("Graph seed location is empty");
    }
    String loc = location.trim();
    try {
      if (loc.startsWith("classpath:")) {
        String resource = loc.substring("classpath:".length());
        try (InputStream in =
            Thread.currentThread().getContextClassLoader().getResourceAsStream(resource)) {
          if (in == null) {
            throw new ConfigException("Graph seed not found on classpath: " + resource);
          }
          return JacksonUtility.getJsonMapper().readValue(in, GraphSeed.class);
        }
      }
      Path path = Path.of(loc);
      if (!Files.isRegularFile(path)) {
        throw new ConfigException("Graph seed file not found: " + path.toAbsolutePath());
      }
      try (InputStream in = Files.newInputStream(path)) {
        return JacksonUtility.getJsonMapper().readValue(in, GraphSeed.class);
      }
    } catch (IOException e) {
      throw new SerializationException("Failed to read graph seed: " + loc, e);
    }
  }
}
