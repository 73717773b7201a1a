package com.gentoro.pathrag.cache;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One cached value plus the bookkeeping used for placement and eviction.
 *
 * <p>Identity fields and importance are immutable; access statistics change while the entry is
 * resident and are safe to update from concurrent readers. The payload may be {@code null} for
 * index-only entries of the persistent tier.
 */
public final class CacheEntry {
  private final String key;
  private final CachePayload payload;
  private final long byteSize;
  private final Instant createdAt;
  private final Map<String, String> metadata;

  private final double importance;
  private volatile Instant lastAccessed;
  private volatile long recency;
  private final AtomicLong accessCount;

  public CacheEntry(
      String key,
      CachePayload payload,
      long byteSize,
      double importance,
      Instant createdAt,
      Map<String, String> metadata) {
    this(key, payload, byteSize, importance, createdAt, createdAt, 0L, metadata);
  }

  CacheEntry(
      String key,
      CachePayload payload,
      long byteSize,
      double importance,
      Instant createdAt,
      Instant lastAccessed,
      long accessCount,
      Map<String, String> metadata) {
    if (key == null || key.isEmpty()) {
      throw new IllegalArgumentException("Cache key cannot be empty");
    }
    if (byteSize < 0) {
      throw new IllegalArgumentException("byteSize cannot be negative");
    }
    this.key = key;
    this.payload = payload;
    this.byteSize = byteSize;
    this.importance = clampImportance(importance);
    this.createdAt = createdAt;
    this.lastAccessed = lastAccessed;
    this.accessCount = new AtomicLong(accessCount);
    this.metadata =
        metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  /** Copy carrying the given payload and the current statistics. */
  public CacheEntry withPayload(CachePayload newPayload) {
    CacheEntry copy =
        new CacheEntry(
            key,
            newPayload,
            byteSize,
            importance,
            createdAt,
            lastAccessed,
            accessCount.get(),
            metadata);
    copy.recency = recency;
    return copy;
  }

  /** Independent copy, so two tiers never share mutable statistics. */
  public CacheEntry copy() {
    return withPayload(payload);
  }

  void touch(Instant now, long tick) {
    lastAccessed = now;
    recency = tick;
    accessCount.incrementAndGet();
  }

  void markResident(long tick) {
    recency = tick;
  }

  public String getKey() {
    return key;
  }

  public CachePayload getPayload() {
    return payload;
  }

  public long getByteSize() {
    return byteSize;
  }

  public double getImportance() {
    return importance;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getLastAccessed() {
    return lastAccessed;
  }

  public long getAccessCount() {
    return accessCount.get();
  }

  /** Logical access order inside the owning tier; larger is more recent. */
  public long getRecency() {
    return recency;
  }

  public Map<String, String> getMetadata() {
    return metadata;
  }

  static double clampImportance(double value) {
    if (Double.isNaN(value)) return 0.0;
    return Math.max(0.0, Math.min(1.0, value));
  }

  @Override
  public String toString() {
    return "CacheEntry{"
        + key
        + ", bytes="
        + byteSize
        + ", importance="
        + String.format("%.3f", importance)
        + ", accesses="
        + accessCount.get()
        + '}';
  }
}
