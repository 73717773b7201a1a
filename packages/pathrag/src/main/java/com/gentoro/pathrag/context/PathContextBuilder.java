package com.gentoro.pathrag.context;

import com.gentoro.pathrag.retrieval.RankedPath;
import java.util.List;

/**
 * Turns ranked paths into the prompt context handed to the language model.
 *
 * <p>Layout: a {@code Query:} header, the fragments chosen by the {@link PlacementPolicy}, and a
 * closing restatement of the query. Header and restatement are scaffolding paid for by the
 * budget's reserved tokens.
 */
public class PathContextBuilder {
  private static final org.slf4j.Logger log =
      com.gentoro.pathrag.logging.LoggingService.getLogger(PathContextBuilder.class);

  private final ContextBudget budget;
  private final TokenCounter tokenCounter;
  private final PlacementPolicy placementPolicy;

  public PathContextBuilder(
      ContextBudget budget, TokenCounter tokenCounter, PlacementPolicy placementPolicy) {
    this.budget = budget;
    this.tokenCounter = tokenCounter;
    this.placementPolicy = placementPolicy;
  }

  public static PathContextBuilder from(ContextConfig config) {
    return new PathContextBuilder(
        config.budget(), new ApproximateTokenCounter(), PlacementPolicy.named(config.placement()));
  }

  /** @param rankedPaths best first */
  public String build(String query, List<RankedPath> rankedPaths) {
    String header = "Query: " + query;
    String closing = "Answer the query using the paths above: " + query;
    int scaffolding = tokenCounter.count(header) + tokenCounter.count(closing);
    if (scaffolding > budget.reservedTokens()) {
      log.warn(
          "Prompt scaffolding needs {} tokens but only {} are reserved",
          scaffolding,
          budget.reservedTokens());
    }

    ContextAssembler assembler = new ContextAssembler(budget, tokenCounter);
    int admitted = placementPolicy.place(rankedPaths, assembler);
    log.debug(
        "Context assembled: {}/{} paths, {} of {} tokens",
        admitted,
        rankedPaths.size(),
        assembler.usedTokens(),
        budget.capacity());

    String body = assembler.assemble();
    StringBuilder sb = new StringBuilder(header).append("\n\n");
    if (!body.isEmpty()) {
      sb.append(body).append("\n\n");
    }
    return sb.append(closing).toString();
  }
}
