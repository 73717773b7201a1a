package com.gentoro.pathrag.cache;

import java.time.Instant;
import java.util.List;

/**
 * Inputs to an importance estimate besides the payload itself.
 *
 * @param now evaluation time
 * @param recentQueries most recent first
 * @param accessCount accesses recorded so far for the entry, 0 for a new one
 */
public record ImportanceContext(Instant now, List<String> recentQueries, long accessCount) {
  public ImportanceContext {
    recentQueries = recentQueries == null ? List.of() : List.copyOf(recentQueries);
  }
}
