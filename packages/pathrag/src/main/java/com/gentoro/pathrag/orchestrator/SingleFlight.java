package com.gentoro.pathrag.orchestrator;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * At most one in-flight computation per key. Callers arriving while a computation runs receive
 * that computation's future instead of starting their own.
 */
class SingleFlight<K, V> {
  private final ConcurrentMap<K, CompletableFuture<V>> inFlight = new ConcurrentHashMap<>();

  /**
   * Join the computation for {@code key}, or run {@code work} on the calling thread when there is
   * none.
   *
   * @return the future of the owning caller; completed exceptionally when {@code work} threw
   */
  CompletableFuture<V> execute(K key, Supplier<V> work) {
    CompletableFuture<V> mine = new CompletableFuture<>();
    CompletableFuture<V> existing = inFlight.putIfAbsent(key, mine);
    if (existing != null) {
      return existing;
    }
    try {
      mine.complete(work.get());
    } catch (RuntimeException e) {
      mine.completeExceptionally(e);
    } finally {
      inFlight.remove(key, mine);
    }
    return mine;
  }

  int inFlightCount() {
    return inFlight.size();
  }
}
