package com.gentoro.pathrag.graph.store;

import com.arangodb.ArangoCursor;
import com.arangodb.ArangoDB;
import com.arangodb.ArangoDatabase;
import com.arangodb.model.AqlQueryOptions;
import com.gentoro.pathrag.exception.ConfigException;
import com.gentoro.pathrag.exception.GraphStoreException;
import com.gentoro.pathrag.exception.IoException;
import com.gentoro.pathrag.graph.GraphEdge;
import com.gentoro.pathrag.graph.GraphNode;
import com.gentoro.pathrag.graph.GraphPath;
import com.gentoro.pathrag.graph.QueryTerms;
import com.gentoro.pathrag.graph.VersionConstraint;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.commons.configuration2.Configuration;

/**
 * ArangoDB implementation of {@link GraphStore}.
 *
 * <p>Runs the AQL traversal template (default {@code /aql/path-traversal.aql}) against an
 * anonymous graph made of one vertex and one edge collection. Version and timestamp constraints
 * are bound as query variables and resolved by the database.
 */
public class ArangoGraphStore implements GraphStore {
  private static final org.slf4j.Logger log =
      com.gentoro.pathrag.logging.LoggingService.getLogger(ArangoGraphStore.class);

  static final String CONFIG_PREFIX = "graph.arangodb.";
  private static final Set<String> NODE_FIELDS =
      Set.of("name", "type", "domain", "observations", "embeddingRef");
  private static final Set<String> EDGE_FIELDS = Set.of("relation", "label", "type", "weight");

  private final String host;
  private final int port;
  private final String user;
  private final String password;
  private final String databaseName;
  private final String vertexCollection;
  private final String edgeCollection;
  private final String traversalQueryPath;
  private final int timeoutMillis;
  private final int resultLimit;

  private ArangoDB arangoDB;
  private ArangoDatabase database;
  private volatile String traversalQueryTemplate;
  private volatile boolean initialized;

  public ArangoGraphStore(Configuration configuration) {
    this.host = configuration.getString(CONFIG_PREFIX + "host", "localhost");
    this.port = configuration.getInt(CONFIG_PREFIX + "port", 8529);
    this.user = configuration.getString(CONFIG_PREFIX + "user", "root");
    this.password = configuration.getString(CONFIG_PREFIX + "password", "");
    this.databaseName = configuration.getString(CONFIG_PREFIX + "database", "pathrag");
    this.vertexCollection =
        configuration.getString(CONFIG_PREFIX + "vertexCollection", "entities");
    this.edgeCollection =
        configuration.getString(CONFIG_PREFIX + "edgeCollection", "relationships");
    this.traversalQueryPath =
        configuration.getString(CONFIG_PREFIX + "traversalQueryPath", "/aql/path-traversal.aql");
    this.timeoutMillis = configuration.getInt(CONFIG_PREFIX + "timeoutMillis", 10_000);
    this.resultLimit = configuration.getInt(CONFIG_PREFIX + "resultLimit", 1000);
  }

  @Override
  public synchronized void initialize() {
    if (initialized) {
      log.debug("ArangoDB graph store already initialized");
      return;
    }
    loadQueryTemplate();

    log.info(
        "Connecting to ArangoDB {}:{} (database: {}, vertices: {}, edges: {})",
        host,
        port,
        databaseName,
        vertexCollection,
        edgeCollection);
    try {
      arangoDB =
          new ArangoDB.Builder()
              .host(host, port)
              .user(user)
              .password(password)
              .timeout(timeoutMillis)
              .build();
      database = arangoDB.db(databaseName);
      if (!database.exists()) {
        throw new ConfigException("ArangoDB database does not exist: " + databaseName);
      }
      initialized = true;
      log.info("ArangoDB graph store initialized");
    } catch (ConfigException e) {
      shutdown();
      throw e;
    } catch (Exception e) {
      shutdown();
      throw new GraphStoreException("Failed to connect to ArangoDB at " + host + ":" + port, e);
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
      throw new GraphStoreException("ArangoDB graph store is not initialized");
    }

    Map<String, Object> bindVars =
        bindVariables(anchorId, maxDepth, domainFilter, versionConstraint);
    log.debug("Executing AQL traversal for anchor: {}", anchorId);
    log.debug("Bind vars: {}", bindVars);
    log.trace("AQL query:\n{}", traversalQueryTemplate);

    List<Map<String, Object>> rows;
    try {
      rows = fetchRows(database, traversalQueryTemplate, bindVars);
    } catch (Exception e) {
      log.error("Error executing AQL traversal for anchor: {}", anchorId, e);
      throw new GraphStoreException("Graph traversal failed for anchor: " + anchorId, e);
    }

    List<GraphPath> paths = new ArrayList<>(rows.size());
    for (Map<String, Object> row : rows) {
      paths.add(toPath(row));
    }
    return paths;
  }

  /** Run an AQL query and drain its cursor, closing it on every exit. */
  @SuppressWarnings({"unchecked", "rawtypes"})
  static List<Map<String, Object>> fetchRows(
      ArangoDatabase db, String aql, Map<String, Object> bindVars) throws IOException {
    try (ArangoCursor<Map> cursor = db.query(aql, Map.class, bindVars, new AqlQueryOptions())) {
      List<Map<String, Object>> rows = new ArrayList<>();
      for (Map row : cursor.asListRemaining()) {
        rows.add(row);
      }
      return rows;
    }
  }

  Map<String, Object> bindVariables(
      String anchorId, int maxDepth, String domainFilter, VersionConstraint versionConstraint) {
    Map<String, Object> bindVars = new HashMap<>();
    bindVars.put("@vertexCollection", vertexCollection);
    bindVars.put("@edgeCollection", edgeCollection);
    bindVars.put("anchor", anchorId == null ? "" : anchorId);
    bindVars.put("terms", QueryTerms.extract(anchorId));
    bindVars.put("maxDepth", maxDepth);
    bindVars.put("domain", domainFilter);
    bindVars.put(
        "asOfVersion",
        versionConstraint != null && versionConstraint.kind() == VersionConstraint.Kind.VERSION
            ? versionConstraint.value()
            : null);
    bindVars.put(
        "asOfTimestamp",
        versionConstraint != null && versionConstraint.kind() == VersionConstraint.Kind.TIMESTAMP
            ? versionConstraint.value()
            : null);
    bindVars.put("limit", resultLimit);
    return bindVars;
  }

  /**
   * Map one traversal row ({@code {vertices: [...], edges: [...]}}) to a {@link GraphPath}.
   *
   * @throws GraphStoreException when the row does not have the expected shape
   */
  static GraphPath toPath(Map<String, Object> row) {
    try {
      Object rawVertices = row == null ? null : row.get("vertices");
      if (!(rawVertices instanceof List<?> vertexList) || vertexList.isEmpty()) {
        throw new IllegalArgumentException("row has no vertices");
      }
      List<GraphNode> vertices = new ArrayList<>(vertexList.size());
      for (Object v : vertexList) {
        vertices.add(toNode(asMap(v)));
      }
      Object rawEdges = row.get("edges");
      if (rawEdges == null) {
        return GraphPath.withoutEdgeData(vertices);
      }
      if (!(rawEdges instanceof List<?> edgeList)) {
        throw new IllegalArgumentException("edges is not a list");
      }
      List<GraphEdge> edges = new ArrayList<>(edgeList.size());
      for (Object e : edgeList) {
        edges.add(toEdge(asMap(e)));
      }
      return new GraphPath(vertices, edges);
    } catch (RuntimeException e) {
      throw new GraphStoreException(
          "Graph store returned malformed path data: " + e.getMessage(), e);
    }
  }

  private static GraphNode toNode(Map<String, Object> doc) {
    String id = stringValue(doc.get("_key"));
    Set<String> observations = new LinkedHashSet<>();
    if (doc.get("observations") instanceof List<?> list) {
      list.forEach(o -> observations.add(String.valueOf(o)));
    }
    return new GraphNode(
        id,
        stringValue(doc.get("name")),
        stringValue(doc.get("type")),
        stringValue(doc.get("domain")),
        observations,
        stringValue(doc.get("embeddingRef")),
        userFields(doc, NODE_FIELDS));
  }

  private static GraphEdge toEdge(Map<String, Object> doc) {
    String relation = stringValue(doc.get("relation"));
    if (relation == null) relation = stringValue(doc.get("label"));
    if (relation == null) relation = stringValue(doc.get("type"));
    if (relation == null) relation = "relates to";
    Object weight = doc.get("weight");
    return new GraphEdge(
        documentKey(stringValue(doc.get("_from"))),
        documentKey(stringValue(doc.get("_to"))),
        relation,
        weight instanceof Number n ? n.doubleValue() : GraphEdge.DEFAULT_WEIGHT,
        userFields(doc, EDGE_FIELDS));
  }

  /** "entities/abc" -> "abc". */
  private static String documentKey(String documentId) {
    if (documentId == null) return null;
    int slash = documentId.indexOf('/');
    return slash >= 0 ? documentId.substring(slash + 1) : documentId;
  }

  private static Map<String, Object> userFields(Map<String, Object> doc, Set<String> known) {
    Map<String, Object> fields = new LinkedHashMap<>();
    doc.forEach(
        (k, v) -> {
          if (!k.startsWith("_") && !known.contains(k) && v != null) {
            fields.put(k, v);
          }
        });
    return fields;
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> asMap(Object o) {
    if (o instanceof Map<?, ?> m) {
      return (Map<String, Object>) m;
    }
    throw new IllegalArgumentException("expected a document, got " + o);
  }

  private static String stringValue(Object o) {
    return o == null ? null : o.toString();
  }

  private void loadQueryTemplate() {
    if (traversalQueryTemplate != null) {
      return;
    }
    try (InputStream is = getClass().getResourceAsStream(traversalQueryPath)) {
      if (is == null) {
        throw new IoException("AQL traversal template not found: " + traversalQueryPath);
      }
      traversalQueryTemplate = new String(is.readAllBytes(), StandardCharsets.UTF_8);
      log.debug("Loaded AQL traversal template from: {}", traversalQueryPath);
    } catch (IOException e) {
      throw new IoException("Failed to load AQL traversal template: " + traversalQueryPath, e);
    }
  }

  @Override
  public String getStoreName() {
    return "arangodb";
  }

  @Override
  public synchronized void shutdown() {
    initialized = false;
    if (arangoDB != null) {
      try {
        arangoDB.shutdown();
      } catch (Exception e) {
        log.warn("Error while closing ArangoDB connection", e);
      } finally {
        arangoDB = null;
        database = null;
      }
    }
  }
}
