package com.gentoro.pathrag.orchestrator;

/** Failure reported to callers of {@link RetrievalOrchestrator#answerContext}. */
public enum RetrievalError {
  /** Graph store unreachable or failed. Not retried. */
  UPSTREAM_UNAVAILABLE,
  /** Graph store exceeded the caller's time budget. Nothing was cached. */
  TIMEOUT,
  INVALID_REQUEST
}
