package com.gentoro.pathrag.cache;

/**
 * Counters of the whole cache.
 *
 * @param fast memory tier statistics
 * @param slow persistent tier statistics, {@code null} when persistence is disabled
 * @param promotions entries copied from the slow tier into the fast tier
 */
public record CacheStats(TierStats fast, TierStats slow, long promotions) {}
