package com.gentoro.pathrag.cache;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/** Minimal payload for cache tests; byte size grows with {@code text}. */
public record TextPayload(String text, Double score, int size, Instant modifiedAt)
    implements CachePayload {

  static final PayloadCodec CODEC = new PayloadCodec(Map.of("text", TextPayload.class));

  public TextPayload(String text) {
    this(text, null, 0, null);
  }

  @Override
  public int richness() {
    return size;
  }

  @Override
  public OptionalDouble confidence() {
    return score == null ? OptionalDouble.empty() : OptionalDouble.of(score);
  }

  @Override
  public Optional<Instant> dataTimestamp() {
    return Optional.ofNullable(modifiedAt);
  }

  @Override
  public String searchableText() {
    return text;
  }
}
