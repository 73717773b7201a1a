package com.gentoro.pathrag.context;

/**
 * A piece of text admitted to the context.
 *
 * @param tokens cost as measured by the assembler's {@link TokenCounter}
 * @param sequence admission order, used to keep output order stable
 */
public record ContextFragment(
    String text, Priority priority, double reliability, int tokens, long sequence) {}
