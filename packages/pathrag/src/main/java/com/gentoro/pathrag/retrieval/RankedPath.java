package com.gentoro.pathrag.retrieval;

import java.time.Instant;
import java.util.List;

/**
 * Caller-facing view of one pruned path. Serializable with Jackson; this is what the cache stores.
 *
 * @param pathText rendered path, see {@link PathFormatter#toText}
 * @param reliability resource-flow score in [0,1]
 * @param nodeIds vertex identifiers in path order
 * @param length number of hops
 * @param confidence mean vertex confidence (1.0 when no vertex declares one)
 * @param observations observations of the path's last vertex
 * @param dataModifiedAt newest modification time of any vertex, may be {@code null}
 */
public record RankedPath(
    String pathText,
    double reliability,
    List<String> nodeIds,
    int length,
    double confidence,
    List<String> observations,
    Instant dataModifiedAt) {

  /** Path with only text and score, for callers that build results by hand. */
  public RankedPath(String pathText, double reliability) {
    this(pathText, reliability, List.of(), 0, 1.0, List.of(), null);
  }
}
