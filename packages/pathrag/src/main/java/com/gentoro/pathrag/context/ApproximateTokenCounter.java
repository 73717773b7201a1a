package com.gentoro.pathrag.context;

/** Whitespace-separated words times 1.3, rounded up. Empty text costs nothing. */
public class ApproximateTokenCounter implements TokenCounter {
  public static final double TOKENS_PER_WORD = 1.3;

  @Override
  public int count(String text) {
    if (text == null) return 0;
    String trimmed = text.strip();
    if (trimmed.isEmpty()) return 0;
    int words = trimmed.split("\\s+").length;
    return (int) Math.ceil(words * TOKENS_PER_WORD);
  }
}
