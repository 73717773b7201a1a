package com.gentoro.pathrag.cache;

import java.time.Clock;

/** Fast, volatile tier: payloads are held on the heap. */
public class MemoryCacheTier extends AbstractCacheTier {
  public static final String NAME = "memory";

  public MemoryCacheTier(long maxBytes) {
    this(maxBytes, Clock.systemUTC());
  }

  public MemoryCacheTier(long maxBytes, Clock clock) {
    super(NAME, maxBytes, clock);
  }
}
