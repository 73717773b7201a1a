package com.gentoro.pathrag.graph;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/** Splits a natural-language query into the lower-case terms used for anchor matching. */
public final class QueryTerms {
  /** Terms of this length or shorter ("the", "of", "is") are ignored. */
  public static final int MIN_EXCLUSIVE_LENGTH = 3;

  private QueryTerms() {}

  public static List<String> extract(String query) {
    if (query == null || query.isBlank()) {
      return List.of();
    }
    Set<String> terms = new LinkedHashSet<>();
    for (String raw : query.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}_-]+")) {
      if (raw.length() > MIN_EXCLUSIVE_LENGTH) {
        terms.add(raw);
      }
    }
    return List.copyOf(terms);
  }
}
