package com.gentoro.pathrag.cache;

import com.gentoro.pathrag.graph.QueryTerms;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Weighted blend of four payload features.
 *
 * <ul>
 *   <li>recency: 1.0 for data modified now, halving every {@code halfLife}; 0.5 when unknown
 *   <li>confidence: payload confidence; 0.5 when unknown
 *   <li>richness: vertices plus edges, saturating at {@link #RICHNESS_CAP}
 *   <li>relevance: share of recent queries with a term occurring in the payload text
 * </ul>
 */
public class HeuristicImportanceScorer implements ImportanceScorer {
  public static final double RECENCY_WEIGHT = 0.3;
  public static final double CONFIDENCE_WEIGHT = 0.3;
  public static final double RICHNESS_WEIGHT = 0.2;
  public static final double RELEVANCE_WEIGHT = 0.2;
  public static final int RICHNESS_CAP = 20;
  private static final double UNKNOWN = 0.5;

  private final Duration halfLife;

  public HeuristicImportanceScorer() {
    this(Duration.ofDays(30));
  }

  public HeuristicImportanceScorer(Duration halfLife) {
    if (halfLife == null || halfLife.isZero() || halfLife.isNegative()) {
      throw new IllegalArgumentException("halfLife must be positive");
    }
    this.halfLife = halfLife;
  }

  @Override
  public double score(CachePayload payload, ImportanceContext context) {
    double score =
        RECENCY_WEIGHT * recency(payload, context.now())
            + CONFIDENCE_WEIGHT * clamp(payload.confidence().orElse(UNKNOWN))
            + RICHNESS_WEIGHT * Math.min(1.0, payload.richness() / (double) RICHNESS_CAP)
            + RELEVANCE_WEIGHT * relevance(payload, context);
    return clamp(score);
  }

  double recency(CachePayload payload, Instant now) {
    return payload
        .dataTimestamp()
        .map(
            ts -> {
              long age = Math.max(0L, Duration.between(ts, now).toMillis());
              return Math.pow(0.5, age / (double) halfLife.toMillis());
            })
        .orElse(UNKNOWN);
  }

  double relevance(CachePayload payload, ImportanceContext context) {
    if (context.recentQueries().isEmpty()) {
      return 0.0;
    }
    String text = payload.searchableText();
    if (text == null || text.isBlank()) {
      return 0.0;
    }
    String haystack = text.toLowerCase(Locale.ROOT);
    long matches =
        context.recentQueries().stream()
            .map(QueryTerms::extract)
            .filter(terms -> terms.stream().anyMatch(haystack::contains))
            .count();
    return matches / (double) context.recentQueries().size();
  }

  private static double clamp(double v) {
    if (Double.isNaN(v)) return 0.0;
    return Math.max(0.0, Math.min(1.0, v));
  }
}
