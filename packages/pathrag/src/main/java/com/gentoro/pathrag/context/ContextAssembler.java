package com.gentoro.pathrag.context;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Collects prioritized text fragments under a token budget.
 *
 * <p>The total cost of admitted fragments never exceeds {@link ContextBudget#capacity()}. When a
 * fragment does not fit, fragments are evicted from LOW, then MEDIUM, then HIGH, least reliable
 * first; a resident fragment is only evicted when it has a lower priority or a strictly lower
 * reliability than the newcomer. If the newcomer still does not fit, every eviction is undone and
 * the newcomer is dropped.
 *
 * <p>Not thread-safe; build one per context.
 */
public class ContextAssembler {
  private static final org.slf4j.Logger log =
      com.gentoro.pathrag.logging.LoggingService.getLogger(ContextAssembler.class);

  static final String SEPARATOR = "\n";

  private final ContextBudget budget;
  private final TokenCounter tokenCounter;
  private final Map<Priority, List<ContextFragment>> buckets = new EnumMap<>(Priority.class);
  private int usedTokens;
  private long sequence;

  public ContextAssembler(ContextBudget budget, TokenCounter tokenCounter) {
    this.budget = budget;
    this.tokenCounter = tokenCounter;
    for (Priority p : Priority.values()) {
      buckets.put(p, new ArrayList<>());
    }
  }

  /**
   * Admit a fragment with reliability 0.0. It can only displace fragments of a lower priority;
   * resident fragments of its own priority are never evicted for it.
   */
  public boolean add(String text, Priority priority) {
    return add(text, priority, 0.0);
  }

  /**
   * Admit a fragment, evicting weaker ones when needed.
   *
   * @return false when the fragment was dropped; the context is then unchanged
   */
  public boolean add(String text, Priority priority, double reliability) {
    if (text == null || text.isBlank()) {
      return false;
    }
    int cost = tokenCounter.count(text);
    int capacity = budget.capacity();
    if (cost > capacity) {
      log.debug("Fragment of {} tokens exceeds capacity {}; dropped", cost, capacity);
      return false;
    }

    List<ContextFragment> evicted = new ArrayList<>();
    if (usedTokens + cost > capacity) {
      for (ContextFragment f : evictionCandidates()) {
        if (usedTokens + cost <= capacity) {
          break;
        }
        if (f.priority().isLowerThan(priority) || f.reliability() < reliability) {
          buckets.get(f.priority()).remove(f);
          usedTokens -= f.tokens();
          evicted.add(f);
        }
      }
    }

    if (usedTokens + cost > capacity) {
      for (ContextFragment f : evicted) {
        List<ContextFragment> bucket = buckets.get(f.priority());
        bucket.add(f);
        bucket.sort(Comparator.comparingLong(ContextFragment::sequence));
        usedTokens += f.tokens();
      }
      log.debug(
          "Fragment of {} tokens ({}, reliability {}) does not fit; dropped",
          cost,
          priority,
          reliability);
      return false;
    }

    buckets.get(priority).add(new ContextFragment(text, priority, reliability, cost, sequence++));
    usedTokens += cost;
    if (!evicted.isEmpty()) {
      log.debug("Evicted {} fragments to admit a {} fragment", evicted.size(), priority);
    }
    return true;
  }

  /** LOW, then MEDIUM, then HIGH; least reliable and oldest first within a bucket. */
  private List<ContextFragment> evictionCandidates() {
    List<ContextFragment> order = new ArrayList<>();
    for (Priority bucket : List.of(Priority.LOW, Priority.MEDIUM, Priority.HIGH)) {
      List<ContextFragment> fragments = new ArrayList<>(buckets.get(bucket));
      fragments.sort(
          Comparator.comparingDouble(ContextFragment::reliability)
              .thenComparingLong(ContextFragment::sequence));
      order.addAll(fragments);
    }
    return order;
  }

  /** Fragments joined HIGH, then MEDIUM, then LOW, each bucket in admission order. */
  public String assemble() {
    return fragments().stream().map(ContextFragment::text).collect(Collectors.joining(SEPARATOR));
  }

  /** Fragments in output order. */
  public List<ContextFragment> fragments() {
    List<ContextFragment> all = new ArrayList<>();
    for (Priority p : Priority.values()) {
      all.addAll(buckets.get(p));
    }
    return all;
  }

  public List<ContextFragment> fragments(Priority priority) {
    return List.copyOf(buckets.get(priority));
  }

  public int usedTokens() {
    return usedTokens;
  }

  public int remainingTokens() {
    return budget.capacity() - usedTokens;
  }
}
