package com.gentoro.pathrag.orchestrator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

import com.gentoro.pathrag.cache.CacheConfig;
import com.gentoro.pathrag.cache.CacheKey;
import com.gentoro.pathrag.cache.CacheResidency;
import com.gentoro.pathrag.cache.PayloadCodec;
import com.gentoro.pathrag.cache.TieredCacheManager;
import com.gentoro.pathrag.context.ContextConfig;
import com.gentoro.pathrag.context.PathContextBuilder;
import com.gentoro.pathrag.exception.GraphStoreException;
import com.gentoro.pathrag.exception.IoException;
import com.gentoro.pathrag.exception.PathRagErrorCode;
import com.gentoro.pathrag.graph.GraphPath;
import com.gentoro.pathrag.graph.TestGraphs;
import com.gentoro.pathrag.graph.store.GraphStore;
import com.gentoro.pathrag.retrieval.PathRetriever;
import com.gentoro.pathrag.retrieval.RankedPath;
import com.gentoro.pathrag.retrieval.RetrievalConfig;
import com.gentoro.pathrag.scoring.PathScorer;
import com.gentoro.pathrag.scoring.ScoringConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RetrievalOrchestratorTest {

  @Mock private GraphStore graphStore;

  private RetrievalOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    lenient().when(graphStore.getStoreName()).thenReturn("mock");
    PathRetriever retriever =
        new PathRetriever(
            graphStore,
            new PathScorer(new ScoringConfig(1.0)),
            new RetrievalConfig(3, 0.01, 5, Duration.ofSeconds(2)));
    TieredCacheManager cache =
        TieredCacheManager.create(
            CacheConfig.memoryOnly(1024 * 1024),
            new PayloadCodec(Map.of(RetrievalPayload.TYPE, RetrievalPayload.class)),
            Clock.systemUTC());
    orchestrator =
        new RetrievalOrchestrator(
            retriever, cache, PathContextBuilder.from(ContextConfig.defaults()));
  }

  @AfterEach
  void tearDown() {
    orchestrator.close();
  }

  private RetrievalOrchestrator persistentOrchestrator(Path cacheDir) {
    PathRetriever retriever =
        new PathRetriever(
            graphStore,
            new PathScorer(new ScoringConfig(1.0)),
            new RetrievalConfig(3, 0.01, 5, Duration.ofSeconds(2)));
    TieredCacheManager cache =
        TieredCacheManager.create(
            new CacheConfig(1024 * 1024, true, cacheDir, 1024 * 1024, 5, 0.7, 20),
            new PayloadCodec(Map.of(RetrievalPayload.TYPE, RetrievalPayload.class)),
            Clock.systemUTC());
    return new RetrievalOrchestrator(
        retriever, cache, PathContextBuilder.from(ContextConfig.defaults()));
  }

  private static List<GraphPath> aliceHops(double... weights) {
    return java.util.Arrays.stream(weights)
        .mapToObj(w -> TestGraphs.hop("alice", "t" + w, w))
        .toList();
  }

  private void stubTraversal(List<GraphPath> paths) {
    when(graphStore.traverse(anyString(), anyInt(), any(), any())).thenReturn(paths);
  }

  @Test
  void secondIdenticalCallIsServedFromCache() {
    stubTraversal(aliceHops(0.9, 0.4));

    RetrievalResponse first = orchestrator.answerContext("alice", 5, null, null, false);
    RetrievalResponse second = orchestrator.answerContext("alice", 5, null, null, false);

    assertEquals(RetrievalResponse.Status.OK, first.status());
    assertFalse(first.fromCache());
    assertTrue(second.fromCache());
    assertEquals(first.paths(), second.paths());
    verify(graphStore, times(1)).traverse(eq("alice"), eq(3), isNull(), isNull());
  }

  @Test
  void maxPathsKeepsTheMostReliablePaths() {
    stubTraversal(aliceHops(0.3, 0.9, 0.5));

    RetrievalResponse response = orchestrator.answerContext("alice", 2, null, null, false);

    assertThat(response.paths()).extracting(RankedPath::reliability).containsExactly(0.9, 0.5);
    assertEquals("alice -[links]-> t0.9", response.paths().get(0).pathText());
    assertNull(response.formattedContext());
  }

  @Test
  void formattedContextEndsWithTheBestPath() {
    stubTraversal(aliceHops(0.3, 0.9, 0.5));

    RetrievalResponse response = orchestrator.answerContext("alice", 3, null, null, true);

    String[] lines = response.formattedContext().split("\n");
    assertEquals("Query: alice", lines[0]);
    assertEquals("alice -[links]-> t0.9", lines[lines.length - 3]);
    assertEquals("Answer the query using the paths above: alice", lines[lines.length - 1]);
  }

  @Test
  void emptyResultIsReportedAndCached() {
    stubTraversal(List.of());

    RetrievalResponse first = orchestrator.answerContext("nobody", 5, null, null, false);
    RetrievalResponse second = orchestrator.answerContext("nobody", 5, null, null, false);

    assertEquals(RetrievalResponse.Status.EMPTY, first.status());
    assertTrue(first.isSuccess());
    assertTrue(second.fromCache());
    verify(graphStore, times(1)).traverse(anyString(), anyInt(), any(), any());
  }

  @Test
  void pathsBelowThresholdAreDropped() {
    stubTraversal(aliceHops(0.005, 0.2));

    RetrievalResponse response = orchestrator.answerContext("alice", 5, null, null, false);

    assertThat(response.paths()).extracting(RankedPath::reliability).containsExactly(0.2);
  }

  @Test
  void upstreamFailureIsReportedAndNotCached() {
    when(graphStore.traverse(anyString(), anyInt(), any(), any()))
        .thenThrow(new GraphStoreException("connection refused"));

    RetrievalResponse first = orchestrator.answerContext("alice", 5, null, null, false);
    orchestrator.answerContext("alice", 5, null, null, false);

    assertEquals(RetrievalResponse.Status.ERROR, first.status());
    assertEquals(RetrievalError.UPSTREAM_UNAVAILABLE, first.error());
    assertEquals(PathRagErrorCode.UPSTREAM_UNAVAILABLE, first.errorDetails().code);
    assertFalse(first.isSuccess());
    verify(graphStore, times(2)).traverse(anyString(), anyInt(), any(), any());
  }

  @Test
  void slowUpstreamTimesOutWithoutCaching() throws Exception {
    CountDownLatch never = new CountDownLatch(1);
    when(graphStore.traverse(anyString(), anyInt(), any(), any()))
        .thenAnswer(
            inv -> {
              never.await(5, TimeUnit.SECONDS);
              return aliceHops(0.9);
            });
    RetrievalRequest request =
        RetrievalRequest.builder("alice").timeout(Duration.ofMillis(100)).build();

    RetrievalResponse response = orchestrator.answerContext(request);

    assertEquals(RetrievalError.TIMEOUT, response.error());
    assertEquals(PathRagErrorCode.TIMEOUT, response.errorDetails().code);
    assertEquals(
        CacheResidency.ABSENT,
        orchestrator.cache().residency(orchestrator.cacheKey(request).value()));
    never.countDown();
  }

  @Test
  void concurrentMissesShareOneRetrieval() throws Exception {
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    when(graphStore.traverse(anyString(), anyInt(), any(), any()))
        .thenAnswer(
            inv -> {
              entered.countDown();
              release.await(5, TimeUnit.SECONDS);
              return aliceHops(0.9);
            });
    RetrievalRequest request =
        RetrievalRequest.builder("alice").timeout(Duration.ofSeconds(5)).build();

    AtomicReference<RetrievalResponse> firstResult = new AtomicReference<>();
    AtomicReference<RetrievalResponse> secondResult = new AtomicReference<>();
    Thread first = new Thread(() -> firstResult.set(orchestrator.answerContext(request)));
    first.start();
    assertTrue(entered.await(5, TimeUnit.SECONDS));

    Thread second = new Thread(() -> secondResult.set(orchestrator.answerContext(request)));
    second.start();
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (second.getState() != Thread.State.TIMED_WAITING && System.nanoTime() < deadline) {
      Thread.sleep(5);
    }
    release.countDown();
    first.join(5000);
    second.join(5000);

    assertEquals(RetrievalResponse.Status.OK, firstResult.get().status());
    assertEquals(firstResult.get().paths(), secondResult.get().paths());
    assertFalse(secondResult.get().fromCache());
    verify(graphStore, times(1)).traverse(anyString(), anyInt(), any(), any());
  }

  @Test
  void invalidRequestsNeverReachTheGraphStore() {
    RetrievalResponse blank = orchestrator.answerContext("  ", 5, null, null, false);
    RetrievalResponse zeroPaths = orchestrator.answerContext("alice", 0, null, null, false);

    assertEquals(RetrievalError.INVALID_REQUEST, blank.error());
    assertEquals(RetrievalError.INVALID_REQUEST, zeroPaths.error());
    assertEquals(PathRagErrorCode.INVALID_ARGUMENT, zeroPaths.errorDetails().code);
    assertEquals(RetrievalError.INVALID_REQUEST, orchestrator.answerContext(null).error());
    verify(graphStore, never()).traverse(anyString(), anyInt(), any(), any());
  }

  @Test
  void cacheKeyCoversEveryResultShapingInput() {
    RetrievalRequest plain = RetrievalRequest.of("alice");
    String key = orchestrator.cacheKey(plain).value();

    assertEquals(key, orchestrator.cacheKey(RetrievalRequest.of("  alice ")).value());
    assertNotEquals(
        key, orchestrator.cacheKey(RetrievalRequest.builder("alice").maxPaths(2).build()).value());
    RetrievalRequest inHr = RetrievalRequest.builder("alice").domainFilter("hr").build();
    assertNotEquals(key, orchestrator.cacheKey(inHr).value());
    assertNotEquals(
        key,
        orchestrator.cacheKey(RetrievalRequest.builder("alice").formatForOutput(true).build())
            .value());
  }

  @Test
  void singleFlightRunsWorkOncePerKey() {
    SingleFlight<String, Integer> flight = new SingleFlight<>();
    AtomicReference<Integer> nested = new AtomicReference<>();

    Integer outer =
        flight
            .execute(
                "k",
                () -> {
                  nested.set(flight.inFlightCount());
                  return 7;
                })
            .join();

    assertEquals(7, outer);
    assertEquals(1, nested.get());
    assertEquals(0, flight.inFlightCount());
  }

  @Test
  void persistentIndexFailureStillAnswersAndServesFromCache(@TempDir Path cacheDir)
      throws Exception {
    stubTraversal(aliceHops(0.9));
    Files.createDirectories(cacheDir.resolve("index.json.tmp"));
    RetrievalOrchestrator persistent = persistentOrchestrator(cacheDir);
    try {
      RetrievalResponse first = persistent.answerContext("alice", 5, null, null, false);
      RetrievalResponse second = persistent.answerContext("alice", 5, null, null, false);

      assertEquals(RetrievalResponse.Status.OK, first.status());
      assertEquals("alice -[links]-> t0.9", first.paths().get(0).pathText());
      assertEquals(RetrievalResponse.Status.OK, second.status());
      assertTrue(second.fromCache());
      assertEquals(first.paths(), second.paths());
      verify(graphStore, times(1)).traverse(anyString(), anyInt(), any(), any());
    } finally {
      persistent.close();
    }
  }

  @Test
  void persistentBlobFailureStillAnswersWithoutCaching(@TempDir Path cacheDir) throws Exception {
    stubTraversal(aliceHops(0.9));
    RetrievalOrchestrator persistent = persistentOrchestrator(cacheDir);
    RetrievalRequest request = new RetrievalRequest("alice", 5, null, null, false, null);
    String key = persistent.cacheKey(request).value();
    Files.createDirectories(cacheDir.resolve(CacheKey.sha256(key) + ".blob.tmp"));
    try {
      RetrievalResponse response = persistent.answerContext(request);

      assertEquals(RetrievalResponse.Status.OK, response.status());
      assertEquals(1, response.paths().size());
      assertFalse(response.fromCache());
      assertEquals(CacheResidency.ABSENT, persistent.cache().residency(key));
      assertTrue(persistent.cache().get(key, "alice").isEmpty());

      RetrievalResponse retried = persistent.answerContext(request);
      assertEquals(RetrievalResponse.Status.OK, retried.status());
      assertFalse(retried.fromCache());
    } finally {
      persistent.close();
    }
  }

  @Test
  void cacheWriteExceptionDoesNotFailTheRetrieval() {
    stubTraversal(aliceHops(0.9));
    TieredCacheManager failing = mock(TieredCacheManager.class);
    when(failing.get(anyString(), anyString())).thenReturn(Optional.empty());
    when(failing.put(anyString(), any(), anyDouble(), anyString()))
        .thenThrow(new IoException("disk full"));
    RetrievalOrchestrator withFailingCache =
        new RetrievalOrchestrator(
            new PathRetriever(
                graphStore,
                new PathScorer(new ScoringConfig(1.0)),
                new RetrievalConfig(3, 0.01, 5, Duration.ofSeconds(2))),
            failing,
            PathContextBuilder.from(ContextConfig.defaults()));
    try {
      RetrievalResponse response = withFailingCache.answerContext("alice", 5, null, null, false);

      assertEquals(RetrievalResponse.Status.OK, response.status());
      assertEquals(1, response.paths().size());
      verify(failing).put(anyString(), any(), anyDouble(), eq("alice"));
    } finally {
      withFailingCache.close();
    }
  }
}
