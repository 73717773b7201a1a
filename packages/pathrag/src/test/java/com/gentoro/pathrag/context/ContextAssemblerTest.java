package com.gentoro.pathrag.context;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Collections;
import java.util.Random;
import org.junit.jupiter.api.Test;

class ContextAssemblerTest {

  /** One token per whitespace-separated word. */
  private static final TokenCounter WORDS =
      text -> text.isBlank() ? 0 : text.strip().split("\\s+").length;

  private static ContextAssembler assembler(int maxTokens, int reserved) {
    return new ContextAssembler(new ContextBudget(maxTokens, reserved), WORDS);
  }

  private static String words(int n, String word) {
    return String.join(" ", Collections.nCopies(n, word));
  }

  @Test
  void emitsHighThenMediumThenLow() {
    ContextAssembler ctx = assembler(100, 0);
    ctx.add("low", Priority.LOW);
    ctx.add("medium", Priority.MEDIUM);
    ctx.add("high", Priority.HIGH);
    ctx.add("medium2", Priority.MEDIUM);

    assertEquals("high\nmedium\nmedium2\nlow", ctx.assemble());
    assertEquals(2, ctx.fragments(Priority.MEDIUM).size());
  }

  @Test
  void reservedTokensAreNotAvailableToFragments() {
    ContextAssembler ctx = assembler(10, 4);
    assertTrue(ctx.add(words(6, "a"), Priority.LOW));
    assertEquals(0, ctx.remainingTokens());
    assertFalse(ctx.add(words(7, "b"), Priority.HIGH));
  }

  @Test
  void evictsLowestPriorityLeastReliableFirst() {
    ContextAssembler ctx = assembler(10, 0);
    ctx.add(words(3, "lowgood"), Priority.LOW, 0.9);
    ctx.add(words(3, "lowbad"), Priority.LOW, 0.1);
    ctx.add(words(4, "medium"), Priority.MEDIUM, 0.5);

    assertTrue(ctx.add(words(3, "high"), Priority.HIGH, 0.5));

    assertThat(ctx.assemble()).doesNotContain("lowbad").contains("lowgood").contains("high");
    assertEquals(10, ctx.usedTokens());
  }

  @Test
  void fragmentWithoutReliabilityOnlyDisplacesLowerPriorities() {
    ContextAssembler ctx = assembler(6, 0);
    ctx.add(words(3, "a"), Priority.HIGH, 0.5);
    ctx.add(words(3, "b"), Priority.HIGH, 0.5);

    assertFalse(ctx.add(words(3, "c"), Priority.HIGH));
    assertEquals(6, ctx.usedTokens());
    assertThat(ctx.assemble()).contains("a").contains("b").doesNotContain("c");

    ContextAssembler mixed = assembler(6, 0);
    mixed.add(words(3, "low"), Priority.LOW, 0.9);
    mixed.add(words(3, "high"), Priority.HIGH, 0.5);

    assertTrue(mixed.add(words(3, "plain"), Priority.MEDIUM));
    assertThat(mixed.assemble()).doesNotContain("low").contains("plain").contains("high");
  }

  @Test
  void higherPriorityFragmentsAreNotEvictedForWeakerOnes() {
    ContextAssembler ctx = assembler(6, 0);
    ctx.add(words(3, "keep"), Priority.HIGH, 0.9);
    ctx.add(words(3, "also"), Priority.MEDIUM, 0.9);

    assertFalse(ctx.add(words(4, "weak"), Priority.LOW, 0.2));

    assertEquals("keep keep keep\nalso also also", ctx.assemble());
  }

  @Test
  void moreReliableFragmentDisplacesLessReliableOneInSameBucket() {
    ContextAssembler ctx = assembler(6, 0);
    ctx.add(words(3, "weak"), Priority.MEDIUM, 0.2);
    ctx.add(words(3, "fair"), Priority.MEDIUM, 0.5);

    assertTrue(ctx.add(words(3, "best"), Priority.MEDIUM, 0.9));

    assertEquals("fair fair fair\nbest best best", ctx.assemble());
  }

  @Test
  void failedAddRollsBackEvictions() {
    ContextAssembler ctx = assembler(10, 0);
    ctx.add(words(2, "low"), Priority.LOW, 0.1);
    ctx.add(words(8, "high"), Priority.HIGH, 0.9);
    String before = ctx.assemble();

    // Evicting "low" frees only 2 tokens; HIGH cannot be displaced by a MEDIUM fragment.
    assertFalse(ctx.add(words(5, "medium"), Priority.MEDIUM, 0.5));

    assertEquals(before, ctx.assemble());
    assertEquals(10, ctx.usedTokens());
  }

  @Test
  void fragmentLargerThanCapacityIsDroppedImmediately() {
    ContextAssembler ctx = assembler(5, 1);
    ctx.add("small", Priority.LOW);
    assertFalse(ctx.add(words(5, "big"), Priority.HIGH, 1.0));
    assertEquals("small", ctx.assemble());
  }

  @Test
  void usageNeverExceedsCapacity() {
    Random random = new Random(42);
    ContextAssembler ctx = assembler(200, 50);
    Priority[] priorities = Priority.values();
    for (int i = 0; i < 500; i++) {
      ctx.add(
          words(1 + random.nextInt(40), "w" + i),
          priorities[random.nextInt(priorities.length)],
          random.nextDouble());
      assertTrue(ctx.usedTokens() <= 150);
      int counted = ctx.fragments().stream().mapToInt(ContextFragment::tokens).sum();
      assertEquals(counted, ctx.usedTokens());
    }
  }

  @Test
  void approximateCounterRoundsUp() {
    ApproximateTokenCounter counter = new ApproximateTokenCounter();
    assertEquals(0, counter.count("   "));
    assertEquals(2, counter.count("one"));
    assertEquals(4, counter.count("one two three"));
    assertEquals(6, counter.count(words(4, "w")));
  }

  @Test
  void budgetRejectsReservationsLargerThanMax() {
    assertThrows(IllegalArgumentException.class, () -> new ContextBudget(10, 11));
    assertThrows(IllegalArgumentException.class, () -> new ContextBudget(0, 0));
  }
}
