package com.gentoro.pathrag.graph.store;

import com.gentoro.pathrag.exception.GraphStoreException;
import com.gentoro.pathrag.exception.StateException;
import com.gentoro.pathrag.graph.GraphEdge;
import com.gentoro.pathrag.graph.GraphNode;
import com.gentoro.pathrag.graph.GraphPath;
import com.gentoro.pathrag.graph.QueryTerms;
import com.gentoro.pathrag.graph.VersionConstraint;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/**
 * Adjacency-list graph store held in memory.
 *
 * <p>Serves as the reference semantics for traversal: every simple outbound path of 1..maxDepth
 * hops from the resolved anchor(s) is returned, in edge insertion order, filtered by the domain of
 * the path's last vertex. Version constraints compare against the {@code version} and {@code
 * createdAt} properties of nodes and edges; elements without them are always visible.
 */
public class InMemoryGraphStore implements GraphStore {
  private static final org.slf4j.Logger log =
      com.gentoro.pathrag.logging.LoggingService.getLogger(InMemoryGraphStore.class);

  public static final String VERSION = "version";
  public static final int DEFAULT_MAX_RESULTS = 1000;

  private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
  private final Map<String, List<GraphEdge>> outbound = new LinkedHashMap<>();
  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final int maxResults;
  private volatile boolean initialized;

  public InMemoryGraphStore() {
    this(DEFAULT_MAX_RESULTS);
  }

  public InMemoryGraphStore(int maxResults) {
    if (maxResults <= 0) {
      throw new IllegalArgumentException("maxResults must be positive");
    }
    this.maxResults = maxResults;
  }

  /** Build a store from a seed document. The store is initialized on return. */
  public static InMemoryGraphStore fromSeed(GraphSeed seed, int maxResults) {
    InMemoryGraphStore store = new InMemoryGraphStore(maxResults);
    seed.toNodes().forEach(store::addNode);
    seed.toEdges().forEach(store::addEdge);
    store.initialize();
    return store;
  }

  public InMemoryGraphStore addNode(GraphNode node) {
    lock.writeLock().lock();
    try {
      nodes.put(node.getId(), node);
      outbound.computeIfAbsent(node.getId(), k -> new ArrayList<>());
    } finally {
      lock.writeLock().unlock();
    }
    return this;
  }

  public InMemoryGraphStore addEdge(GraphEdge edge) {
    lock.writeLock().lock();
    try {
      if (!nodes.containsKey(edge.getFromKey()) || !nodes.containsKey(edge.getToKey())) {
        throw new StateException("Edge references unknown node: " + edge);
      }
      outbound.get(edge.getFromKey()).add(edge);
    } finally {
      lock.writeLock().unlock();
    }
    return this;
  }

  public int nodeCount() {
    lock.readLock().lock();
    try {
      return nodes.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public void initialize() {
    if (!initialized) {
      initialized = true;
      log.info("In-memory graph store ready with {} nodes", nodeCount());
    }
  }

  @Override
  public boolean isInitialized() {
    return initialized;
  }

  @Override
  public List<GraphPath> traverse(
      String anchorId, int maxDepth, String domainFilter, VersionConstraint versionConstraint) {
    if (!initialized) {
      throw new GraphStoreException("In-memory graph store is not initialized");
    }
    Predicate<Map<String, Object>> visible = visibility(versionConstraint);

    lock.readLock().lock();
    try {
      List<GraphPath> results = new ArrayList<>();
      for (GraphNode start : resolveAnchors(anchorId)) {
        if (!visible.test(start.getMetadata())) {
          continue;
        }
        List<GraphNode> vertices = new ArrayList<>();
        vertices.add(start);
        walk(vertices, new ArrayList<>(), maxDepth, domainFilter, visible, results);
        if (results.size() >= maxResults) {
          log.debug("Traversal from '{}' capped at {} paths", anchorId, maxResults);
          break;
        }
      }
      log.debug(
          "Traversal anchor='{}' depth={} domain={} version={} -> {} paths",
          anchorId,
          maxDepth,
          domainFilter,
          versionConstraint,
          results.size());
      return results;
    } finally {
      lock.readLock().unlock();
    }
  }

  private void walk(
      List<GraphNode> vertices,
      List<GraphEdge> edges,
      int maxDepth,
      String domainFilter,
      Predicate<Map<String, Object>> visible,
      List<GraphPath> results) {
    if (edges.size() >= maxDepth || results.size() >= maxResults) {
      return;
    }
    GraphNode current = vertices.get(vertices.size() - 1);
    for (GraphEdge edge : outbound.getOrDefault(current.getId(), List.of())) {
      GraphNode next = nodes.get(edge.getToKey());
      if (!visible.test(edge.getProperties()) || !visible.test(next.getMetadata())) {
        continue;
      }
      if (vertices.contains(next)) {
        continue;
      }
      vertices.add(next);
      edges.add(edge);
      if (domainFilter == null || domainFilter.equals(next.getDomain())) {
        results.add(new GraphPath(vertices, edges));
        if (results.size() >= maxResults) {
          vertices.remove(vertices.size() - 1);
          edges.remove(edges.size() - 1);
          return;
        }
      }
      walk(vertices, edges, maxDepth, domainFilter, visible, results);
      vertices.remove(vertices.size() - 1);
      edges.remove(edges.size() - 1);
    }
  }

  /** Exact id, then case-insensitive name, then query-term match on names and observations. */
  List<GraphNode> resolveAnchors(String anchor) {
    if (anchor == null || anchor.isBlank()) {
      return List.of();
    }
    GraphNode exact = nodes.get(anchor);
    if (exact != null) {
      return List.of(exact);
    }
    List<GraphNode> byName =
        nodes.values().stream().filter(n -> n.getName().equalsIgnoreCase(anchor.trim())).toList();
    if (!byName.isEmpty()) {
      return byName;
    }
    List<String> terms = QueryTerms.extract(anchor);
    if (terms.isEmpty()) {
      return List.of();
    }
    return nodes.values().stream().filter(n -> mentionsAny(n, terms)).toList();
  }

  private static boolean mentionsAny(GraphNode node, List<String> terms) {
    String name = node.getName().toLowerCase(Locale.ROOT);
    for (String term : terms) {
      if (name.contains(term)) {
        return true;
      }
      for (String observation : node.getObservations()) {
        if (observation.toLowerCase(Locale.ROOT).contains(term)) {
          return true;
        }
      }
    }
    return false;
  }

  private static Predicate<Map<String, Object>> visibility(VersionConstraint constraint) {
    if (constraint == null) {
      return props -> true;
    }
    if (constraint.kind() == VersionConstraint.Kind.VERSION) {
      String asOf = constraint.value();
      return props -> {
        Object v = props.get(VERSION);
        return v == null || compareVersions(v.toString(), asOf) <= 0;
      };
    }
    Instant asOf;
    try {
      asOf = Instant.parse(constraint.value());
    } catch (DateTimeParseException e) {
      throw new GraphStoreException("Unreadable timestamp constraint: " + constraint.value(), e);
    }
    return props -> {
      Optional<Instant> created = parseInstant(props.get(GraphNode.CREATED_AT));
      return created.isEmpty() || !created.get().isAfter(asOf);
    };
  }

  private static Optional<Instant> parseInstant(Object raw) {
    if (raw == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(Instant.parse(raw.toString()));
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }

  /** Dotted version comparison ("v1.10" > "v1.9"); non-numeric segments compare as text. */
  static int compareVersions(String a, String b) {
    String[] left = stripPrefix(a).split("\\.");
    String[] right = stripPrefix(b).split("\\.");
    for (int i = 0; i < Math.max(left.length, right.length); i++) {
      String l = i < left.length ? left[i] : "0";
      String r = i < right.length ? right[i] : "0";
      int cmp;
      if (l.matches("\\d+") && r.matches("\\d+")) {
        String ln = l.replaceFirst("^0+(?=\\d)", "");
        String rn = r.replaceFirst("^0+(?=\\d)", "");
        cmp =
            ln.length() != rn.length()
                ? Integer.compare(ln.length(), rn.length())
                : ln.compareTo(rn);
      } else {
        cmp = l.compareTo(r);
      }
      if (cmp != 0) {
        return cmp;
      }
    }
    return 0;
  }

  private static String stripPrefix(String version) {
    String v = version.trim();
    return v.startsWith("v") || v.startsWith("V") ? v.substring(1) : v;
  }

  @Override
  public String getStoreName() {
    return "in-memory";
  }

  @Override
  public void shutdown() {
    initialized = false;
  }
}
