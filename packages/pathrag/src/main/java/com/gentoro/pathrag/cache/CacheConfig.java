package com.gentoro.pathrag.cache;

import com.gentoro.pathrag.exception.ConfigException;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;

/**
 * Tiered cache parameters.
 *
 * @param memoryMaxBytes fast tier budget
 * @param persistentEnabled whether a slow tier exists; without it every entry goes to memory
 * @param persistentDirectory slow tier directory
 * @param persistentMaxBytes slow tier budget
 * @param promotionAccessCount slow-tier hits beyond which an entry is promoted
 * @param highImportanceThreshold importance beyond which an entry goes (or is promoted) to memory
 * @param recentQueryWindow number of recent queries remembered for relevance scoring
 */
public record CacheConfig(
    long memoryMaxBytes,
    boolean persistentEnabled,
    Path persistentDirectory,
    long persistentMaxBytes,
    int promotionAccessCount,
    double highImportanceThreshold,
    int recentQueryWindow) {

  public static final long DEFAULT_MEMORY_MAX_BYTES = 16L * 1024 * 1024;
  public static final long DEFAULT_PERSISTENT_MAX_BYTES = 256L * 1024 * 1024;
  public static final String DEFAULT_DIRECTORY = ".pathrag-cache";

  public CacheConfig {
    if (memoryMaxBytes <= 0) {
      throw new IllegalArgumentException("memory budget must be positive: " + memoryMaxBytes);
    }
    if (persistentEnabled) {
      if (persistentDirectory == null) {
        throw new IllegalArgumentException("persistent directory is required");
      }
      if (persistentMaxBytes <= 0) {
        throw new IllegalArgumentException(
            "persistent budget must be positive: " + persistentMaxBytes);
      }
    }
    if (promotionAccessCount < 0) {
      throw new IllegalArgumentException("promotionAccessCount cannot be negative");
    }
    if (!(highImportanceThreshold >= 0.0 && highImportanceThreshold <= 1.0)) {
      throw new IllegalArgumentException(
          "highImportanceThreshold must lie in [0,1]: " + highImportanceThreshold);
    }
    if (recentQueryWindow < 0) {
      throw new IllegalArgumentException("recentQueryWindow cannot be negative");
    }
  }

  /** Memory-only cache with default thresholds. */
  public static CacheConfig memoryOnly(long memoryMaxBytes) {
    return new CacheConfig(memoryMaxBytes, false, null, 0L, 5, 0.7, 20);
  }

  public static CacheConfig from(Configuration cfg) {
    try {
      boolean persistent = cfg.getBoolean("pathrag.cache.persistent.enabled", true);
      String dir = cfg.getString("pathrag.cache.persistent.directory", DEFAULT_DIRECTORY);
      return new CacheConfig(
          cfg.getLong("pathrag.cache.memory.maxBytes", DEFAULT_MEMORY_MAX_BYTES),
          persistent,
          dir == null || dir.isBlank() ? null : Path.of(dir),
          cfg.getLong("pathrag.cache.persistent.maxBytes", DEFAULT_PERSISTENT_MAX_BYTES),
          cfg.getInt("pathrag.cache.promotionAccessCount", 5),
          cfg.getDouble("pathrag.cache.highImportanceThreshold", 0.7),
          cfg.getInt("pathrag.cache.recentQueryWindow", 20));
    } catch (IllegalArgumentException e) {
      throw new ConfigException("Invalid pathrag.cache configuration: " + e.getMessage(), e);
    }
  }
}
