package com.gentoro.pathrag.cache;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Value stored by the cache tiers.
 *
 * <p>Implementations are Jackson-serializable and registered with {@link PayloadCodec} under a
 * type name. The feature accessors feed the {@link ImportanceScorer}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
public interface CachePayload {

  /** Amount of structure carried (vertices plus edges across all paths). */
  @JsonIgnore
  int richness();

  /** Confidence or reliability of the content, when known. */
  @JsonIgnore
  OptionalDouble confidence();

  /** Freshness of the underlying data, when known. */
  @JsonIgnore
  Optional<Instant> dataTimestamp();

  /** Text matched against recent queries. */
  @JsonIgnore
  String searchableText();
}
