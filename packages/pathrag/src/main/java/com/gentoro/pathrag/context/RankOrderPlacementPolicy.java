package com.gentoro.pathrag.context;

import com.gentoro.pathrag.retrieval.PathFormatter;
import com.gentoro.pathrag.retrieval.RankedPath;
import java.util.List;

/** Best path first in the HIGH bucket, the rest in MEDIUM in rank order. */
public class RankOrderPlacementPolicy implements PlacementPolicy {
  public static final String NAME = "rank-order";

  @Override
  public int place(List<RankedPath> rankedPaths, ContextAssembler assembler) {
    int admitted = 0;
    for (int i = 0; i < rankedPaths.size(); i++) {
      RankedPath path = rankedPaths.get(i);
      Priority priority = i == 0 ? Priority.HIGH : Priority.MEDIUM;
      if (assembler.add(PathFormatter.toFragment(path), priority, path.reliability())) {
        admitted++;
      }
    }
    return admitted;
  }
}
