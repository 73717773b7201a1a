package com.gentoro.pathrag.cache;

import com.gentoro.pathrag.exception.PathRagException;
import com.gentoro.pathrag.exception.ValidationException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Two-level cache: a fast memory tier in front of an optional persistent tier.
 *
 * <p>New entries go to memory when their importance exceeds the high-importance threshold (or when
 * there is no persistent tier) and to the persistent tier otherwise. A persistent hit promotes the
 * entry when it has been accessed more than {@code promotionAccessCount} times or scores above the
 * threshold. Promotion copies the entry; the persistent copy stays as the durable backing copy.
 *
 * <p>Operations on one key are serialized through a striped lock; different keys proceed
 * concurrently.
 */
public class TieredCacheManager implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.pathrag.logging.LoggingService.getLogger(TieredCacheManager.class);

  private static final int LOCK_STRIPES = 64;
  public static final String QUERY_METADATA = "query";

  private final CacheConfig config;
  private final CacheTier fastTier;
  private final CacheTier slowTier;
  private final ImportanceScorer importanceScorer;
  private final PayloadCodec codec;
  private final Clock clock;
  private final ReentrantLock[] keyLocks = new ReentrantLock[LOCK_STRIPES];
  private final Deque<String> recentQueries = new ArrayDeque<>();
  private final AtomicLong promotions = new AtomicLong();

  public TieredCacheManager(
      CacheConfig config,
      CacheTier fastTier,
      CacheTier slowTier,
      ImportanceScorer importanceScorer,
      PayloadCodec codec,
      Clock clock) {
    this.config = config;
    this.fastTier = fastTier;
    this.slowTier = slowTier;
    this.importanceScorer = importanceScorer;
    this.codec = codec;
    this.clock = clock;
    for (int i = 0; i < LOCK_STRIPES; i++) {
      keyLocks[i] = new ReentrantLock();
    }
  }

  /** Build both tiers from configuration with the heuristic importance scorer. */
  public static TieredCacheManager create(CacheConfig config, PayloadCodec codec, Clock clock) {
    CacheTier fast = new MemoryCacheTier(config.memoryMaxBytes(), clock);
    CacheTier slow =
        config.persistentEnabled()
            ? new PersistentCacheTier(
                config.persistentDirectory(), config.persistentMaxBytes(), codec, clock)
            : null;
    log.info(
        "Tiered cache: memory {} bytes, persistent {}",
        config.memoryMaxBytes(),
        slow == null
            ? "disabled"
            : config.persistentDirectory() + " (" + config.persistentMaxBytes() + " bytes)");
    return new TieredCacheManager(
        config, fast, slow, new HeuristicImportanceScorer(), codec, clock);
  }

  /**
   * Look a key up, fast tier first.
   *
   * @param context the query that triggered the lookup; recorded for relevance scoring, may be
   *     {@code null}
   */
  public Optional<CachePayload> get(String key, String context) {
    requireKey(key);
    recordQuery(context);
    Optional<CacheEntry> fast = fastTier.get(key);
    if (fast.isPresent()) {
      log.debug("Cache hit (memory) for {}", key);
      return Optional.of(fast.get().getPayload());
    }
    if (slowTier == null) {
      log.debug("Cache miss for {}", key);
      return Optional.empty();
    }
    ReentrantLock lock = lockFor(key);
    lock.lock();
    try {
      Optional<CacheEntry> slow;
      try {
        slow = slowTier.get(key);
      } catch (PathRagException e) {
        log.warn("Persistent cache read failed for {}; treating as a miss", key, e);
        return Optional.empty();
      }
      if (slow.isEmpty()) {
        log.debug("Cache miss for {}", key);
        return Optional.empty();
      }
      CacheEntry entry = slow.get();
      double importance =
          importanceScorer.score(
              entry.getPayload(),
              new ImportanceContext(clock.instant(), recentQueries(), entry.getAccessCount()));
      if (entry.getAccessCount() > config.promotionAccessCount()
          || Math.max(entry.getImportance(), importance) > config.highImportanceThreshold()) {
        promoteLocked(entry);
      }
      log.debug("Cache hit (persistent) for {}", key);
      return Optional.of(entry.getPayload());
    } finally {
      lock.unlock();
    }
  }

  public boolean put(String key, CachePayload payload) {
    return put(key, payload, null, null);
  }

  /**
   * Store a payload.
   *
   * @param importance explicit importance in [0,1]; {@code null} lets the scorer decide
   * @param context the query this payload answers, may be {@code null}
   * @return true when at least one tier accepted the entry
   */
  public boolean put(String key, CachePayload payload, Double importance, String context) {
    requireKey(key);
    if (payload == null) {
      throw new ValidationException("Cache payload cannot be null");
    }
    recordQuery(context);
    Instant now = clock.instant();
    double effective =
        importance != null
            ? importance
            : importanceScorer.score(payload, new ImportanceContext(now, recentQueries(), 0L));
    Map<String, String> metadata = new LinkedHashMap<>();
    if (context != null && !context.isBlank()) {
      metadata.put(QUERY_METADATA, context);
    }
    CacheEntry entry =
        new CacheEntry(key, payload, codec.sizeOf(payload), effective, now, metadata);

    ReentrantLock lock = lockFor(key);
    lock.lock();
    try {
      boolean fastAccepted = false;
      boolean slowAccepted = false;
      if (slowTier == null || entry.getImportance() > config.highImportanceThreshold()) {
        fastAccepted = fastTier.put(entry.copy());
      } else {
        fastTier.remove(key);
      }
      if (slowTier != null) {
        slowAccepted = putSlow(entry);
      }
      if (!fastAccepted && !slowAccepted) {
        log.debug("Cache write rejected for {} ({} bytes)", key, entry.getByteSize());
        return false;
      }
      log.debug(
          "Cached {} ({} bytes, importance {}) in {}",
          key,
          entry.getByteSize(),
          String.format("%.3f", entry.getImportance()),
          fastAccepted ? (slowAccepted ? "memory+persistent" : "memory") : "persistent");
      return true;
    } finally {
      lock.unlock();
    }
  }

  /** Write to the persistent tier; a failure rejects the write and drops any stale copy. */
  private boolean putSlow(CacheEntry entry) {
    try {
      return slowTier.put(entry.copy());
    } catch (PathRagException e) {
      log.warn("Persistent cache write failed for {}: {}", entry.getKey(), e.getMessage(), e);
    }
    try {
      slowTier.remove(entry.getKey());
    } catch (PathRagException e) {
      log.warn("Could not drop stale persistent entry {}", entry.getKey(), e);
    }
    return false;
  }

  /**
   * Copy a persistent entry into the memory tier. Idempotent: a key already in memory is left
   * untouched.
   *
   * @return true when the key is resident in memory afterwards
   */
  public boolean promote(String key) {
    requireKey(key);
    ReentrantLock lock = lockFor(key);
    lock.lock();
    try {
      if (fastTier.contains(key)) {
        return true;
      }
      if (slowTier == null) {
        return false;
      }
      return slowTier.peek(key).map(this::promoteLocked).orElse(false);
    } finally {
      lock.unlock();
    }
  }

  private boolean promoteLocked(CacheEntry entry) {
    if (fastTier.contains(entry.getKey())) {
      return true;
    }
    boolean accepted = fastTier.put(entry.copy());
    if (accepted) {
      promotions.incrementAndGet();
      log.debug("Promoted {} to memory", entry);
    } else {
      log.debug("Promotion of {} refused by memory tier", entry.getKey());
    }
    return accepted;
  }

  public CacheResidency residency(String key) {
    if (fastTier.contains(key)) return CacheResidency.FAST;
    if (slowTier != null && slowTier.contains(key)) return CacheResidency.SLOW;
    return CacheResidency.ABSENT;
  }

  /** Drop a key from both tiers. */
  public boolean invalidate(String key) {
    requireKey(key);
    ReentrantLock lock = lockFor(key);
    lock.lock();
    try {
      boolean removed = fastTier.remove(key).isPresent();
      if (slowTier != null) {
        removed |= slowTier.remove(key).isPresent();
      }
      return removed;
    } finally {
      lock.unlock();
    }
  }

  public void clear() {
    fastTier.clear();
    if (slowTier != null) {
      slowTier.clear();
    }
    synchronized (recentQueries) {
      recentQueries.clear();
    }
    log.info("Cache cleared");
  }

  public CacheStats stats() {
    return new CacheStats(
        fastTier.stats(), slowTier == null ? null : slowTier.stats(), promotions.get());
  }

  /** Most recent first. */
  public List<String> recentQueries() {
    synchronized (recentQueries) {
      return new ArrayList<>(recentQueries);
    }
  }

  @Override
  public void close() {
    fastTier.close();
    if (slowTier != null) {
      slowTier.close();
    }
  }

  private void recordQuery(String context) {
    if (context == null || context.isBlank() || config.recentQueryWindow() == 0) {
      return;
    }
    synchronized (recentQueries) {
      recentQueries.remove(context);
      recentQueries.addFirst(context);
      while (recentQueries.size() > config.recentQueryWindow()) {
        recentQueries.removeLast();
      }
    }
  }

  private ReentrantLock lockFor(String key) {
    return keyLocks[Math.floorMod(key.hashCode(), LOCK_STRIPES)];
  }

  private static void requireKey(String key) {
    if (key == null || key.isEmpty()) {
      throw new ValidationException("Cache key cannot be empty");
    }
  }
}
