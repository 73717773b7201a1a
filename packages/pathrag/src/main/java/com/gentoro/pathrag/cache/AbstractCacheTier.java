package com.gentoro.pathrag.cache;

import java.time.Clock;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Byte budget and eviction shared by every tier.
 *
 * <p>Lookups run under the read lock and may proceed concurrently; inserts, removals and evictions
 * take the write lock. Subclasses plug storage in through the {@code load/store/discard} hooks.
 */
public abstract class AbstractCacheTier implements CacheTier {
  private static final org.slf4j.Logger log =
      com.gentoro.pathrag.logging.LoggingService.getLogger(AbstractCacheTier.class);

  /** Eviction order: oldest access first, then fewest accesses, then lowest importance. */
  static final Comparator<CacheEntry> EVICTION_ORDER =
      Comparator.comparing(CacheEntry::getLastAccessed)
          .thenComparingLong(CacheEntry::getAccessCount)
          .thenComparingDouble(CacheEntry::getImportance)
          .thenComparingLong(CacheEntry::getRecency);

  protected final String name;
  protected final long maxBytes;
  protected final Clock clock;
  protected final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
  protected final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

  private volatile long usedBytes;
  private final AtomicLong ticks = new AtomicLong();
  private final AtomicLong hits = new AtomicLong();
  private final AtomicLong misses = new AtomicLong();
  private final AtomicLong evictions = new AtomicLong();
  private final AtomicLong rejections = new AtomicLong();

  protected AbstractCacheTier(String name, long maxBytes, Clock clock) {
    if (maxBytes <= 0) {
      throw new IllegalArgumentException(name + " tier budget must be positive: " + maxBytes);
    }
    this.name = name;
    this.maxBytes = maxBytes;
    this.clock = clock;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public Optional<CacheEntry> get(String key) {
    CacheEntry loaded;
    lock.readLock().lock();
    try {
      CacheEntry entry = entries.get(key);
      if (entry == null) {
        misses.incrementAndGet();
        return Optional.empty();
      }
      loaded = load(entry);
      if (loaded != null) {
        entry.touch(clock.instant(), ticks.incrementAndGet());
        hits.incrementAndGet();
        afterAccess(entry);
        return Optional.of(loaded == entry ? entry : entry.withPayload(loaded.getPayload()));
      }
      misses.incrementAndGet();
    } finally {
      lock.readLock().unlock();
    }
    log.warn("{} tier: entry '{}' is unreadable; removing it", name, key);
    remove(key);
    return Optional.empty();
  }

  @Override
  public Optional<CacheEntry> peek(String key) {
    lock.readLock().lock();
    try {
      CacheEntry entry = entries.get(key);
      return entry == null ? Optional.empty() : Optional.ofNullable(load(entry));
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public boolean contains(String key) {
    return entries.containsKey(key);
  }

  @Override
  public boolean put(CacheEntry entry) {
    if (entry.getByteSize() > maxBytes) {
      rejections.incrementAndGet();
      log.debug(
          "{} tier: refusing '{}' ({} bytes > budget {})",
          name,
          entry.getKey(),
          entry.getByteSize(),
          maxBytes);
      return false;
    }
    lock.writeLock().lock();
    try {
      CacheEntry resident = store(entry);
      CacheEntry previous = entries.remove(entry.getKey());
      long used = usedBytes;
      if (previous != null) {
        used -= previous.getByteSize();
      }
      while (used + entry.getByteSize() > maxBytes && !entries.isEmpty()) {
        CacheEntry victim = entries.values().stream().min(EVICTION_ORDER).orElseThrow();
        entries.remove(victim.getKey());
        used -= victim.getByteSize();
        evictions.incrementAndGet();
        discard(victim);
        log.debug("{} tier: evicted {}", name, victim);
      }
      resident.markResident(ticks.incrementAndGet());
      entries.put(resident.getKey(), resident);
      usedBytes = used + resident.getByteSize();
      afterMutation();
      return true;
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public Optional<CacheEntry> remove(String key) {
    lock.writeLock().lock();
    try {
      CacheEntry removed = entries.remove(key);
      if (removed == null) {
        return Optional.empty();
      }
      usedBytes -= removed.getByteSize();
      discard(removed);
      afterMutation();
      return Optional.of(removed);
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public void clear() {
    lock.writeLock().lock();
    try {
      for (CacheEntry entry : entries.values()) {
        discard(entry);
      }
      entries.clear();
      usedBytes = 0;
      afterMutation();
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public Set<String> keys() {
    return new HashSet<>(entries.keySet());
  }

  @Override
  public long usedBytes() {
    return usedBytes;
  }

  @Override
  public long maxBytes() {
    return maxBytes;
  }

  @Override
  public TierStats stats() {
    return new TierStats(
        name,
        entries.size(),
        usedBytes,
        maxBytes,
        hits.get(),
        misses.get(),
        evictions.get(),
        rejections.get());
  }

  /** Seed an entry read back from storage. Caller holds the write lock or is the constructor. */
  protected void restore(CacheEntry entry) {
    entry.markResident(ticks.incrementAndGet());
    entries.put(entry.getKey(), entry);
    usedBytes += entry.getByteSize();
  }

  /**
   * Materialize the payload of a resident entry.
   *
   * @return the entry with its payload, or {@code null} when the stored value is unreadable
   */
  protected CacheEntry load(CacheEntry resident) {
    return resident;
  }

  /**
   * Persist the entry's payload before it becomes visible. May throw to abort the insert.
   *
   * @return the form of the entry kept resident in this tier
   */
  protected CacheEntry store(CacheEntry entry) {
    return entry;
  }

  /** Release storage held by an evicted or removed entry. */
  protected void discard(CacheEntry entry) {}

  /** Called under the write lock after the set of entries changed. */
  protected void afterMutation() {}

  /** Called under the read lock after a hit updated the entry's statistics. */
  protected void afterAccess(CacheEntry entry) {}
}
