package com.gentoro.pathrag.context;

/**
 * Token limits of one assembled context.
 *
 * @param maxTokens size of the model's context window allotted to retrieval
 * @param reservedTokens tokens kept free for prompt scaffolding around the fragments
 */
public record ContextBudget(int maxTokens, int reservedTokens) {
  public ContextBudget {
    if (maxTokens <= 0) {
      throw new IllegalArgumentException("maxTokens must be positive: " + maxTokens);
    }
    if (reservedTokens < 0 || reservedTokens > maxTokens) {
      throw new IllegalArgumentException(
          "reservedTokens must lie in [0,maxTokens]: " + reservedTokens);
    }
  }

  /** Tokens available to fragments. */
  public int capacity() {
    return maxTokens - reservedTokens;
  }
}
