package com.gentoro.pathrag.graph.store;

import com.gentoro.pathrag.exception.ConfigException;
import java.util.Locale;
import org.apache.commons.configuration2.Configuration;

/**
 * Selects the graph store implementation from configuration key {@code graph.store}.
 *
 * <p>{@code in-memory} (default) optionally loads {@code graph.inMemory.seedFile}; {@code arangodb}
 * reads the {@code graph.arangodb.*} block.
 */
public final class GraphStoreFactory {
  private static final org.slf4j.Logger log =
      com.gentoro.pathrag.logging.LoggingService.getLogger(GraphStoreFactory.class);

  private GraphStoreFactory() {}

  public static GraphStore create(Configuration configuration) {
    String id = configuration.getString("graph.store", "in-memory").trim().toLowerCase(Locale.ROOT);
    log.info("Using graph store: {}", id);
    switch (id) {
      case "in-memory":
        int maxResults =
            configuration.getInt(
                "graph.inMemory.maxResults", InMemoryGraphStore.DEFAULT_MAX_RESULTS);
        String seedFile = configuration.getString("graph.inMemory.seedFile", null);
        if (seedFile == null || seedFile.isBlank()) {
          return new InMemoryGraphStore(maxResults);
        }
        return InMemoryGraphStore.fromSeed(GraphSeed.load(seedFile), maxResults);
      case "arangodb":
        return new ArangoGraphStore(configuration);
      default:
        throw new ConfigException("Unsupported graph store: " + id);
    }
  }
}
