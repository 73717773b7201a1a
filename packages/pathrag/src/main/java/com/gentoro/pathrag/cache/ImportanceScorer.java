package com.gentoro.pathrag.cache;

/** Estimates how valuable a payload is to keep in the fast tier, in [0,1]. */
@FunctionalInterface
public interface ImportanceScorer {
  double score(CachePayload payload, ImportanceContext context);
}
