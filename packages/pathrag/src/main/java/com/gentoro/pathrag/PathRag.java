package com.gentoro.pathrag;

import com.gentoro.pathrag.cache.CacheConfig;
import com.gentoro.pathrag.cache.PayloadCodec;
import com.gentoro.pathrag.cache.TieredCacheManager;
import com.gentoro.pathrag.context.ContextConfig;
import com.gentoro.pathrag.context.PathContextBuilder;
import com.gentoro.pathrag.exception.StateException;
import com.gentoro.pathrag.graph.store.GraphStore;
import com.gentoro.pathrag.graph.store.GraphStoreFactory;
import com.gentoro.pathrag.orchestrator.RetrievalOrchestrator;
import com.gentoro.pathrag.orchestrator.RetrievalPayload;
import com.gentoro.pathrag.retrieval.PathRetriever;
import com.gentoro.pathrag.retrieval.RetrievalConfig;
import com.gentoro.pathrag.scoring.PathScorer;
import com.gentoro.pathrag.scoring.ScoringConfig;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;

/**
 * Application context: reads configuration and wires graph store, scorer, retriever, cache and
 * orchestrator.
 */
public class PathRag implements AutoCloseable {

  private static final org.slf4j.Logger log =
      com.gentoro.pathrag.logging.LoggingService.getLogger(PathRag.class);

  private final String configLocation;
  private ConfigurationProvider configurationProvider;
  private GraphStore graphStore;
  private RetrievalOrchestrator orchestrator;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

  public PathRag(String configLocation) {
    this.configLocation = configLocation;
  }

  public void initialize() {
    this.configurationProvider = new ConfigurationProvider(configLocation);
    com.gentoro.pathrag.logging.LoggingService.applyConfiguration(configuration());

    Configuration cfg = configuration();
    this.graphStore = GraphStoreFactory.create(cfg);
    graphStore.initialize();

    PathRetriever retriever =
        new PathRetriever(
            graphStore, new PathScorer(ScoringConfig.from(cfg)), RetrievalConfig.from(cfg));
    TieredCacheManager cache =
        TieredCacheManager.create(
            CacheConfig.from(cfg),
            new PayloadCodec(Map.of(RetrievalPayload.TYPE, RetrievalPayload.class)),
            Clock.systemUTC());
    this.orchestrator =
        new RetrievalOrchestrator(
            retriever, cache, PathContextBuilder.from(ContextConfig.from(cfg)));
    log.info("PathRAG initialized with graph store '{}'", graphStore.getStoreName());
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (!shuttingDown.compareAndSet(false, true)) {
      return;
    }
    try {
      if (orchestrator != null) {
        orchestrator.close();
      }
    } finally {
      if (graphStore != null) {
        graphStore.shutdown();
      }
    }
  }

  @Override
  public void close() {
    shutdown();
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("PathRag not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public RetrievalOrchestrator orchestrator() {
    if (orchestrator == null) {
      throw new StateException("PathRag not initialized. Call initialize() first.");
    }
    return orchestrator;
  }

  public GraphStore graphStore() {
    return graphStore;
  }
}
