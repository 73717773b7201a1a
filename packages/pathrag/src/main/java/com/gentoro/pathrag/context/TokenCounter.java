package com.gentoro.pathrag.context;

/** Counts the tokens a piece of text costs in the downstream model's context window. */
@FunctionalInterface
public interface TokenCounter {
  int count(String text);
}
