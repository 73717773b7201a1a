package com.gentoro.pathrag.context;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.pathrag.retrieval.RankedPath;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class PathContextBuilderTest {

  private static final List<RankedPath> RANKED =
      List.of(
          new RankedPath("Alice -[works for]-> Acme", 0.9),
          new RankedPath("Alice -[knows]-> Bob", 0.6),
          new RankedPath("Alice -[lives in]-> Berlin", 0.3));

  private static PathContextBuilder builder(PlacementPolicy policy) {
    return new PathContextBuilder(
        new ContextBudget(4000, 500), new ApproximateTokenCounter(), policy);
  }

  @Test
  void goldenPositionPutsBestPathRightBeforeClosingLine() {
    String context =
        builder(new GoldenPositionPlacementPolicy()).build("Where does Alice work?", RANKED);

    String[] lines = context.split("\n");
    assertEquals("Query: Where does Alice work?", lines[0]);
    assertEquals("Answer the query using the paths above: Where does Alice work?",
        lines[lines.length - 1]);
    assertEquals("Alice -[works for]-> Acme", lines[lines.length - 3]);
    assertThat(context.indexOf("lives in")).isLessThan(context.indexOf("knows"));
    assertThat(context.indexOf("knows")).isLessThan(context.indexOf("works for"));
  }

  @Test
  void rankOrderPutsBestPathFirst() {
    String context = builder(new RankOrderPlacementPolicy()).build("q", RANKED);

    assertEquals(
        "Query: q\n\n"
            + "Alice -[works for]-> Acme\n"
            + "Alice -[knows]-> Bob\n"
            + "Alice -[lives in]-> Berlin\n\n"
            + "Answer the query using the paths above: q",
        context);
  }

  @Test
  void emptyResultStillCarriesScaffolding() {
    String context = builder(new GoldenPositionPlacementPolicy()).build("q", List.of());
    assertEquals("Query: q\n\nAnswer the query using the paths above: q", context);
  }

  @Test
  void observationsFollowThePathText() {
    RankedPath path =
        new RankedPath(
            "Curie -[discovered]-> Radium",
            0.8,
            List.of("curie", "radium"),
            1,
            1.0,
            List.of("element 88", "isolated 1910"),
            Instant.parse("2024-01-01T00:00:00Z"));

    String context = builder(new GoldenPositionPlacementPolicy()).build("q", List.of(path));

    assertThat(context).contains("Curie -[discovered]-> Radium (element 88; isolated 1910)");
  }

  @Test
  void tightBudgetKeepsTheMostReliablePaths() {
    // Each path costs ceil(4 * 1.3) = 6 tokens; capacity fits two.
    PathContextBuilder tight =
        new PathContextBuilder(
            new ContextBudget(13, 1), new ApproximateTokenCounter(),
            new GoldenPositionPlacementPolicy());
    List<RankedPath> paths =
        List.of(
            new RankedPath("a -> b c", 0.9),
            new RankedPath("d -> e f", 0.6),
            new RankedPath("g -> h i", 0.3));

    String context = tight.build("q", paths);

    assertThat(context).contains("a -> b c").contains("d -> e f").doesNotContain("g -> h i");
    assertThat(context.indexOf("d -> e f")).isLessThan(context.indexOf("a -> b c"));
  }

  @Test
  void placementPoliciesResolveByName() {
    assertInstanceOf(GoldenPositionPlacementPolicy.class, PlacementPolicy.named(null));
    assertInstanceOf(GoldenPositionPlacementPolicy.class, PlacementPolicy.named("golden-position"));
    assertInstanceOf(RankOrderPlacementPolicy.class, PlacementPolicy.named("RANK-ORDER"));
    assertThrows(IllegalArgumentException.class, () -> PlacementPolicy.named("random"));
  }
}
