package com.gentoro.pathrag.orchestrator;

import com.gentoro.pathrag.cache.CachePayload;
import com.gentoro.pathrag.retrieval.RankedPath;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Cached result of one retrieval.
 *
 * @param paths best first, possibly empty
 * @param formattedContext present when the request asked for formatting
 */
public record RetrievalPayload(
    String query, List<RankedPath> paths, String formattedContext, Instant retrievedAt)
    implements CachePayload {
  public static final String TYPE = "retrieval";

  public RetrievalPayload {
    paths = paths == null ? List.of() : List.copyOf(paths);
  }

  @Override
  public int richness() {
    return paths.stream().mapToInt(p -> p.nodeIds().size() + p.length()).sum();
  }

  @Override
  public OptionalDouble confidence() {
    return paths.stream().mapToDouble(RankedPath::confidence).average();
  }

  @Override
  public Optional<Instant> dataTimestamp() {
    return paths.stream()
        .map(RankedPath::dataModifiedAt)
        .filter(Objects::nonNull)
        .max(Instant::compareTo);
  }

  @Override
  public String searchableText() {
    return paths.stream()
        .flatMap(p -> Stream.concat(Stream.of(p.pathText()), p.observations().stream()))
        .collect(Collectors.joining("\n"));
  }
}
