package com.gentoro.pathrag.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A directed, weighted relation between two nodes.
 *
 * <p>The relation is an active-voice verb phrase ("depends on", "was founded by"). The weight is
 * the primary input to path scoring; it defaults to 1.0 and must be a finite, non-negative number.
 */
public final class GraphEdge {
  public static final double DEFAULT_WEIGHT = 1.0;

  private final String fromKey;
  private final String toKey;
  private final String relation;
  private final double weight;
  private final Map<String, Object> properties;

  public GraphEdge(String fromKey, String toKey, String relation) {
    this(fromKey, toKey, relation, DEFAULT_WEIGHT, Map.of());
  }

  public GraphEdge(String fromKey, String toKey, String relation, double weight) {
    this(fromKey, toKey, relation, weight, Map.of());
  }

  public GraphEdge(
      String fromKey,
      String toKey,
      String relation,
      double weight,
      Map<String, Object> properties) {
    if (fromKey == null || fromKey.isBlank() || toKey == null || toKey.isBlank()) {
      throw new IllegalArgumentException("Edge endpoints cannot be null or empty");
    }
    if (relation == null || relation.trim().isEmpty()) {
      throw new IllegalArgumentException("Edge relation cannot be null or empty");
    }
    if (Double.isNaN(weight) || Double.isInfinite(weight) || weight < 0.0) {
      throw new IllegalArgumentException(
          "Edge weight must be a finite non-negative number: " + weight);
    }
    this.fromKey = fromKey;
    this.toKey = toKey;
    this.relation = relation.trim();
    this.weight = weight;
    this.properties =
        properties == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
  }

  public String getFromKey() {
    return fromKey;
  }

  public String getToKey() {
    return toKey;
  }

  public String getRelation() {
    return relation;
  }

  public double getWeight() {
    return weight;
  }

  public Map<String, Object> getProperties() {
    return properties;
  }

  @Override
  public String toString() {
    return fromKey + " -[" + relation + " w=" + weight + "]-> " + toKey;
  }
}
