package com.gentoro.pathrag.context;

import com.gentoro.pathrag.retrieval.PathFormatter;
import com.gentoro.pathrag.retrieval.RankedPath;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Puts the most reliable path last, right before the closing restatement of the query, where
 * language models attend most strongly. All paths share the MEDIUM bucket and are inserted from
 * least to most reliable.
 */
public class GoldenPositionPlacementPolicy implements PlacementPolicy {
  public static final String NAME = "golden-position";

  @Override
  public int place(List<RankedPath> rankedPaths, ContextAssembler assembler) {
    List<RankedPath> ascending = new ArrayList<>(rankedPaths);
    Collections.reverse(ascending);
    int admitted = 0;
    for (RankedPath path : ascending) {
      if (assembler.add(PathFormatter.toFragment(path), Priority.MEDIUM, path.reliability())) {
        admitted++;
      }
    }
    return admitted;
  }
}
