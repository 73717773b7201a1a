package com.gentoro.pathrag.orchestrator;

import com.gentoro.pathrag.cache.CacheKey;
import com.gentoro.pathrag.cache.CachePayload;
import com.gentoro.pathrag.cache.TieredCacheManager;
import com.gentoro.pathrag.context.PathContextBuilder;
import com.gentoro.pathrag.exception.ExceptionUtil;
import com.gentoro.pathrag.exception.PathRagErrorCode;
import com.gentoro.pathrag.exception.PathRagException;
import com.gentoro.pathrag.exception.ValidationException;
import com.gentoro.pathrag.graph.ScoredPath;
import com.gentoro.pathrag.graph.VersionConstraint;
import com.gentoro.pathrag.retrieval.PathFormatter;
import com.gentoro.pathrag.retrieval.PathRetriever;
import com.gentoro.pathrag.retrieval.RankedPath;
import com.gentoro.pathrag.retrieval.RetrievalConfig;
import com.gentoro.pathrag.retrieval.RetrievalResult;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Cache-first entry point: key the request, serve it from the cache, or retrieve, prune, cache and
 * optionally format.
 *
 * <p>Concurrent misses on one key share a single upstream retrieval; later callers wait for the
 * first caller's result. Upstream calls run on the orchestrator's executor and are bounded by the
 * request timeout (or the configured one). A timed-out retrieval writes nothing to the cache.
 */
public class RetrievalOrchestrator implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.pathrag.logging.LoggingService.getLogger(RetrievalOrchestrator.class);

  static final double EMPTY_RESULT_IMPORTANCE = 0.05;

  private final PathRetriever retriever;
  private final TieredCacheManager cache;
  private final PathContextBuilder contextBuilder;
  private final ExecutorService executor;
  private final Clock clock;
  private final SingleFlight<String, RetrievalResponse> singleFlight = new SingleFlight<>();

  public RetrievalOrchestrator(
      PathRetriever retriever, TieredCacheManager cache, PathContextBuilder contextBuilder) {
    this(retriever, cache, contextBuilder, newUpstreamExecutor(), Clock.systemUTC());
  }

  public RetrievalOrchestrator(
      PathRetriever retriever,
      TieredCacheManager cache,
      PathContextBuilder contextBuilder,
      ExecutorService executor,
      Clock clock) {
    this.retriever = retriever;
    this.cache = cache;
    this.contextBuilder = contextBuilder;
    this.executor = executor;
    this.clock = clock;
  }

  private static ExecutorService newUpstreamExecutor() {
    AtomicInteger counter = new AtomicInteger();
    return Executors.newCachedThreadPool(
        r -> {
          Thread t = new Thread(r, "pathrag-upstream-" + counter.incrementAndGet());
          t.setDaemon(true);
          return t;
        });
  }

  public RetrievalResponse answerContext(
      String query,
      int maxPaths,
      String domainFilter,
      VersionConstraint versionConstraint,
      boolean formatForOutput) {
    RetrievalRequest request;
    try {
      request =
          new RetrievalRequest(
              query, maxPaths, domainFilter, versionConstraint, formatForOutput, null);
    } catch (ValidationException e) {
      log.warn("Rejected request '{}': {}", query, e.getMessage());
      return RetrievalResponse.failure(
          query,
          versionConstraint,
          RetrievalError.INVALID_REQUEST,
          ExceptionUtil.toErrorDetails(e));
    }
    return answerContext(request);
  }

  public RetrievalResponse answerContext(RetrievalRequest request) {
    if (request == null) {
      ValidationException e = new ValidationException("request cannot be null");
      return RetrievalResponse.failure(
          null, null, RetrievalError.INVALID_REQUEST, ExceptionUtil.toErrorDetails(e));
    }
    CacheKey key = cacheKey(request);
    Optional<RetrievalResponse> cached = fromCache(key, request);
    if (cached.isPresent()) {
      log.debug("Serving '{}' from cache", request.query());
      return cached.get();
    }

    Duration timeout = timeoutOf(request);
    CompletableFuture<RetrievalResponse> flight =
        singleFlight.execute(
            key.value(),
            () -> fromCache(key, request).orElseGet(() -> retrieveAndCache(key, request, timeout)));
    try {
      if (!flight.isDone()) {
        log.debug("Waiting for in-flight retrieval of '{}'", request.query());
      }
      return flight.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      return timeoutResponse(request, timeout);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return upstreamFailure(request, e);
    } catch (ExecutionException e) {
      return upstreamFailure(request, ExceptionUtil.unwrap(e));
    }
  }

  private Optional<RetrievalResponse> fromCache(CacheKey key, RetrievalRequest request) {
    Optional<CachePayload> hit = cache.get(key.value(), request.query());
    if (hit.isEmpty()) {
      return Optional.empty();
    }
    if (!(hit.get() instanceof RetrievalPayload payload)) {
      log.warn(
          "Ignoring cache entry {} of unexpected type {}",
          key.value(),
          hit.get().getClass().getSimpleName());
      return Optional.empty();
    }
    String formatted = null;
    if (request.formatForOutput()) {
      formatted =
          payload.formattedContext() != null
              ? payload.formattedContext()
              : contextBuilder.build(request.query(), payload.paths());
    }
    return Optional.of(RetrievalResponse.of(request, payload.paths(), formatted, true));
  }

  private RetrievalResponse retrieveAndCache(
      CacheKey key, RetrievalRequest request, Duration timeout) {
    RetrievalConfig config = retriever.config();
    Future<RetrievalResult> upstream =
        executor.submit(
            () ->
                retriever.retrieveCandidates(
                    request.query(),
                    config.maxDepth(),
                    request.domainFilter(),
                    request.versionConstraint()));
    RetrievalResult result;
    try {
      result = upstream.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      upstream.cancel(true);
      return timeoutResponse(request, timeout);
    } catch (InterruptedException e) {
      upstream.cancel(true);
      Thread.currentThread().interrupt();
      return upstreamFailure(request, e);
    } catch (ExecutionException e) {
      return upstreamFailure(request, ExceptionUtil.unwrap(e));
    }
    if (!result.isSuccess()) {
      return upstreamFailure(request, result.getFailure());
    }

    List<ScoredPath> pruned =
        retriever.prune(result.getPaths(), config.pruningThreshold(), request.maxPaths());
    List<RankedPath> ranked = pruned.stream().map(PathFormatter::toRankedPath).toList();
    String formatted =
        request.formatForOutput() ? contextBuilder.build(request.query(), ranked) : null;

    double importance =
        ranked.isEmpty()
            ? EMPTY_RESULT_IMPORTANCE
            : Math.min(1.0, 0.2 + 0.8 * ranked.size() / (double) request.maxPaths());
    RetrievalPayload payload =
        new RetrievalPayload(request.query(), ranked, formatted, clock.instant());
    cacheQuietly(key, payload, importance, request.query());
    log.info(
        "Retrieved {} paths for '{}' ({} candidates)",
        ranked.size(),
        request.query(),
        result.getPaths().size());
    return RetrievalResponse.of(request, ranked, formatted, false);
  }

  private void cacheQuietly(CacheKey key, RetrievalPayload payload, double importance, String q) {
    try {
      if (!cache.put(key.value(), payload, importance, q)) {
        log.debug("Result for '{}' was not cached", q);
      }
    } catch (PathRagException e) {
      log.warn("Caching the result for '{}' failed: {}", q, e.getMessage(), e);
    }
  }

  /** Deterministic key over every input that affects the result. */
  CacheKey cacheKey(RetrievalRequest request) {
    RetrievalConfig config = retriever.config();
    Map<String, Object> params = new LinkedHashMap<>();
    params.put("query", request.query());
    params.put("maxPaths", request.maxPaths());
    params.put("domain", request.domainFilter());
    params.put("version", request.versionConstraint());
    params.put("format", request.formatForOutput());
    params.put("maxDepth", config.maxDepth());
    params.put("threshold", config.pruningThreshold());
    params.put("decay", retriever.scorer().decayRate());
    return CacheKey.of(params);
  }

  private Duration timeoutOf(RetrievalRequest request) {
    return request.timeout() != null ? request.timeout() : retriever.config().timeout();
  }

  private RetrievalResponse timeoutResponse(RetrievalRequest request, Duration timeout) {
    log.warn("Retrieval of '{}' timed out after {} ms", request.query(), timeout.toMillis());
    return RetrievalResponse.failure(
        request.query(),
        request.versionConstraint(),
        RetrievalError.TIMEOUT,
        ExceptionUtil.toErrorDetails(
            PathRagErrorCode.TIMEOUT,
            "Graph store did not answer within " + timeout.toMillis() + " ms",
            Map.of("timeoutMillis", timeout.toMillis())));
  }

  private RetrievalResponse upstreamFailure(RetrievalRequest request, Throwable cause) {
    log.error(
        "Retrieval of '{}' failed: {}",
        request.query(),
        ExceptionUtil.formatCompactStackTrace(cause, 5));
    return RetrievalResponse.failure(
        request.query(),
        request.versionConstraint(),
        RetrievalError.UPSTREAM_UNAVAILABLE,
        ExceptionUtil.toErrorDetails(cause));
  }

  public TieredCacheManager cache() {
    return cache;
  }

  @Override
  public void close() {
    executor.shutdownNow();
    cache.close();
  }
}
