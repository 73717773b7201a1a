package com.gentoro.pathrag.cache;

/** Point-in-time counters of one cache tier. */
public record TierStats(
    String tier,
    int entries,
    long usedBytes,
    long maxBytes,
    long hits,
    long misses,
    long evictions,
    long rejections) {}
