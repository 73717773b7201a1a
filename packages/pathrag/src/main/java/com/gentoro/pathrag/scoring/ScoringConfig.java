package com.gentoro.pathrag.scoring;

import com.gentoro.pathrag.exception.ConfigException;
import org.apache.commons.configuration2.Configuration;

/**
 * Path scoring parameters.
 *
 * @param decayRate per-hop decay in (0,1]; near 1 favours long paths, near 0 penalises depth
 */
public record ScoringConfig(double decayRate) {
  public static final double DEFAULT_DECAY_RATE = 0.85;

  public ScoringConfig {
    PathScorer.checkDecayRate(decayRate);
  }

  public static ScoringConfig defaults() {
    return new ScoringConfig(DEFAULT_DECAY_RATE);
  }

  public static ScoringConfig from(Configuration cfg) {
    double decay = cfg.getDouble("pathrag.scoring.decayRate", DEFAULT_DECAY_RATE);
    try {
      return new ScoringConfig(decay);
    } catch (IllegalArgumentException e) {
      throw new ConfigException("Invalid pathrag.scoring.decayRate: " + decay, e);
    }
  }
}
