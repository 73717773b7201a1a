package com.gentoro.pathrag.retrieval;

import com.gentoro.pathrag.exception.GraphStoreException;
import com.gentoro.pathrag.exception.MalformedPathException;
import com.gentoro.pathrag.exception.ValidationException;
import com.gentoro.pathrag.graph.GraphPath;
import com.gentoro.pathrag.graph.ScoredPath;
import com.gentoro.pathrag.graph.VersionConstraint;
import com.gentoro.pathrag.graph.store.GraphStore;
import com.gentoro.pathrag.scoring.PathScorer;
import java.util.ArrayList;
import java.util.List;

/**
 * Fetches candidate paths from the {@link GraphStore} and prunes them by resource-flow
 * reliability.
 *
 * <p>Pruning keeps paths scoring at or above the threshold, orders them by {@link
 * ScoredPath#RANKING} and optionally truncates. Malformed paths are logged and skipped.
 */
public class PathRetriever {
  private static final org.slf4j.Logger log =
      com.gentoro.pathrag.logging.LoggingService.getLogger(PathRetriever.class);

  private final GraphStore graphStore;
  private final PathScorer scorer;
  private final RetrievalConfig config;

  public PathRetriever(GraphStore graphStore, PathScorer scorer, RetrievalConfig config) {
    this.graphStore = graphStore;
    this.scorer = scorer;
    this.config = config;
  }

  public RetrievalConfig config() {
    return config;
  }

  public PathScorer scorer() {
    return scorer;
  }

  /**
   * Issue one bounded-depth traversal.
   *
   * @throws ValidationException when the depth is outside [1,7] or the anchor is blank
   */
  public RetrievalResult retrieveCandidates(
      String anchor, int maxDepth, String domainFilter, VersionConstraint versionConstraint) {
    if (anchor == null || anchor.isBlank()) {
      throw new ValidationException("Anchor cannot be empty");
    }
    if (maxDepth < RetrievalConfig.MIN_DEPTH || maxDepth > RetrievalConfig.MAX_DEPTH) {
      throw new ValidationException("maxDepth must lie in [1,7]: " + maxDepth);
    }

    log.info(
        "Retrieving paths: anchor='{}', depth={}, domain={}, version={}",
        anchor,
        maxDepth,
        domainFilter,
        versionConstraint);
    List<GraphPath> raw;
    try {
      raw = graphStore.traverse(anchor, maxDepth, domainFilter, versionConstraint);
    } catch (GraphStoreException e) {
      log.error("Graph store '{}' failed for anchor '{}'", graphStore.getStoreName(), anchor, e);
      return RetrievalResult.failed(e);
    } catch (RuntimeException e) {
      log.error("Unexpected graph store error for anchor '{}'", anchor, e);
      return RetrievalResult.failed(
          new GraphStoreException("Graph store error for anchor: " + anchor, e));
    }
    if (raw == null) {
      return RetrievalResult.failed(
          new GraphStoreException("Graph store returned no result for anchor: " + anchor));
    }
    log.debug("Graph store returned {} candidate paths for '{}'", raw.size(), anchor);
    return RetrievalResult.success(raw);
  }

  /** Prune with the configured threshold and path limit. */
  public List<ScoredPath> prune(List<GraphPath> candidates) {
    return prune(candidates, config.pruningThreshold(), config.maxPaths());
  }

  /** Score, drop below {@code threshold}, sort. Nothing is truncated. */
  public List<ScoredPath> prune(List<GraphPath> candidates, double threshold) {
    return prune(candidates, threshold, Integer.MAX_VALUE);
  }

  public List<ScoredPath> prune(List<GraphPath> candidates, double threshold, int maxPaths) {
    if (maxPaths <= 0) {
      throw new ValidationException("maxPaths must be positive: " + maxPaths);
    }
    List<ScoredPath> kept = new ArrayList<>();
    int malformed = 0;
    for (GraphPath candidate : candidates) {
      ScoredPath scored;
      try {
        scored = scorer.score(candidate);
      } catch (MalformedPathException e) {
        malformed++;
        log.warn("Dropping malformed path {}: {}", candidate, e.getContext());
        continue;
      }
      if (scored.reliability() >= threshold) {
        kept.add(scored);
      }
    }
    kept.sort(ScoredPath.RANKING);
    List<ScoredPath> result =
        kept.size() > maxPaths ? List.copyOf(kept.subList(0, maxPaths)) : kept;
    log.debug(
        "Pruned {} candidates (threshold {}): {} kept, {} malformed, {} returned",
        candidates.size(),
        threshold,
        kept.size(),
        malformed,
        result.size());
    return result;
  }
}
