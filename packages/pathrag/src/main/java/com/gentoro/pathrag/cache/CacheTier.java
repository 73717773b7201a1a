package com.gentoro.pathrag.cache;

import java.util.Optional;
import java.util.Set;

/**
 * A byte-budgeted cache level.
 *
 * <p>All tiers share one eviction discipline: when an insert would exceed the budget, the least
 * recently accessed entries are removed first (ties: fewest accesses, then lowest importance). An
 * entry larger than the whole budget is refused. Tiers differ only in latency and durability.
 */
public interface CacheTier extends AutoCloseable {

  String name();

  /** Lookup that counts as an access (recency, access count, hit/miss statistics). */
  Optional<CacheEntry> get(String key);

  /** Lookup that leaves statistics untouched. */
  Optional<CacheEntry> peek(String key);

  boolean contains(String key);

  /**
   * Insert or replace an entry, evicting as needed.
   *
   * @return false when the entry is larger than the tier's budget
   */
  boolean put(CacheEntry entry);

  Optional<CacheEntry> remove(String key);

  void clear();

  Set<String> keys();

  long usedBytes();

  long maxBytes();

  TierStats stats();

  @Override
  default void close() {}
}
