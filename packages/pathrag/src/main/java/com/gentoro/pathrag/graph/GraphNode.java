package com.gentoro.pathrag.graph;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * A typed vertex of the knowledge graph as seen by the retrieval engine.
 *
 * <p>Nodes are immutable snapshots: the graph store owns the write path, the engine only reads.
 * Observations are atomic facts about the node ("founded in 1998"). Metadata is free-form; two
 * keys are understood by the engine: {@code confidence} (a number in [0,1]) and {@code
 * updatedAt}/{@code createdAt} (ISO-8601 instants).
 */
public final class GraphNode {
  public static final String CONFIDENCE = "confidence";
  public static final String UPDATED_AT = "updatedAt";
  public static final String CREATED_AT = "createdAt";

  private final String id;
  private final String name;
  private final String type;
  private final String domain;
  private final Set<String> observations;
  private final String embeddingRef;
  private final Map<String, Object> metadata;

  public GraphNode(String id, String name, String type, String domain) {
    this(id, name, type, domain, Set.of(), null, Map.of());
  }

  public GraphNode(
      String id,
      String name,
      String type,
      String domain,
      Set<String> observations,
      String embeddingRef,
      Map<String, Object> metadata) {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Node id cannot be null or empty");
    }
    this.id = id;
    this.name = name == null || name.isBlank() ? id : name;
    this.type = type;
    this.domain = domain;
    this.observations =
        observations == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(observations));
    this.embeddingRef = embeddingRef;
    this.metadata =
        metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public String getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getType() {
    return type;
  }

  public String getDomain() {
    return domain;
  }

  public Set<String> getObservations() {
    return observations;
  }

  public Optional<String> getEmbeddingRef() {
    return Optional.ofNullable(embeddingRef);
  }

  public Map<String, Object> getMetadata() {
    return metadata;
  }

  /** Confidence carried in metadata, if it is a number in [0,1]. */
  public OptionalDouble confidence() {
    Object raw = metadata.get(CONFIDENCE);
    if (raw instanceof Number n) {
      double v = n.doubleValue();
      if (v >= 0.0 && v <= 1.0) {
        return OptionalDouble.of(v);
      }
    }
    return OptionalDouble.empty();
  }

  /** Most recent of {@code updatedAt} and {@code createdAt}; unparsable values are ignored. */
  public Optional<Instant> lastModified() {
    Optional<Instant> updated = parseInstant(metadata.get(UPDATED_AT));
    return updated.isPresent() ? updated : parseInstant(metadata.get(CREATED_AT));
  }

  static Optional<Instant> parseInstant(Object raw) {
    if (raw instanceof Instant instant) {
      return Optional.of(instant);
    }
    if (raw instanceof String s && !s.isBlank()) {
      try {
        return Optional.of(Instant.parse(s.trim()));
      } catch (DateTimeParseException e) {
        return Optional.empty();
      }
    }
    return Optional.empty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof GraphNode other)) return false;
    return id.equals(other.id);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id);
  }

  @Override
  public String toString() {
    return "GraphNode{" + id + (name.equals(id) ? "" : ", name=" + name) + '}';
  }
}
