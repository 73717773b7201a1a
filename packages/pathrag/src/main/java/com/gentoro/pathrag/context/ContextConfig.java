package com.gentoro.pathrag.context;

import com.gentoro.pathrag.exception.ConfigException;
import org.apache.commons.configuration2.Configuration;

/**
 * Context assembly parameters.
 *
 * @param placement name of the {@link PlacementPolicy}
 */
public record ContextConfig(ContextBudget budget, String placement) {
  public static final int DEFAULT_MAX_TOKENS = 4000;
  public static final int DEFAULT_RESERVED_TOKENS = 500;

  public static ContextConfig defaults() {
    return new ContextConfig(
        new ContextBudget(DEFAULT_MAX_TOKENS, DEFAULT_RESERVED_TOKENS),
        GoldenPositionPlacementPolicy.NAME);
  }

  public static ContextConfig from(Configuration cfg) {
    try {
      ContextConfig config =
          new ContextConfig(
              new ContextBudget(
                  cfg.getInt("pathrag.context.maxTokens", DEFAULT_MAX_TOKENS),
                  cfg.getInt("pathrag.context.reservedTokens", DEFAULT_RESERVED_TOKENS)),
              cfg.getString("pathrag.context.placement", GoldenPositionPlacementPolicy.NAME));
      PlacementPolicy.named(config.placement());
      return config;
    } catch (IllegalArgumentException e) {
      throw new ConfigException("Invalid pathrag.context configuration: " + e.getMessage(), e);
    }
  }
}
