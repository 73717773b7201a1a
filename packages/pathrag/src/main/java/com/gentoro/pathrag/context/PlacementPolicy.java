package com.gentoro.pathrag.context;

import com.gentoro.pathrag.retrieval.RankedPath;
import java.util.List;

/** Decides the bucket and insertion order of ranked paths in an assembled context. */
public interface PlacementPolicy {

  /**
   * Add the paths to the assembler.
   *
   * @param rankedPaths best first
   * @return number of paths admitted
   */
  int place(List<RankedPath> rankedPaths, ContextAssembler assembler);

  /** Resolve a policy by its configuration name. */
  static PlacementPolicy named(String name) {
    if (name == null
        || name.isBlank()
        || GoldenPositionPlacementPolicy.NAME.equalsIgnoreCase(name)) {
      return new GoldenPositionPlacementPolicy();
    }
    if (RankOrderPlacementPolicy.NAME.equalsIgnoreCase(name)) {
      return new RankOrderPlacementPolicy();
    }
    throw new IllegalArgumentException("Unknown placement policy: " + name);
  }
}
