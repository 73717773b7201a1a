package com.gentoro.pathrag.cache;

/** Where a key currently lives. Entries resident in both tiers report {@link #FAST}. */
public enum CacheResidency {
  ABSENT,
  FAST,
  SLOW
}
