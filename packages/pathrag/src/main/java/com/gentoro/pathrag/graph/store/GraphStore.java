package com.gentoro.pathrag.graph.store;

import com.gentoro.pathrag.exception.GraphStoreException;
import com.gentoro.pathrag.graph.GraphPath;
import com.gentoro.pathrag.graph.VersionConstraint;
import java.util.List;

/**
 * Read-only boundary to the external graph store.
 *
 * <p>The engine does not know the store's query language or storage format. It asks for every
 * outbound path of 1..{@code maxDepth} hops from an anchor and gets raw paths back; scoring and
 * pruning happen on this side of the boundary.
 */
public interface GraphStore extends AutoCloseable {

  /** Open connections and load resources. Calling it twice is harmless. */
  void initialize();

  /**
   * @return true when the store is ready to serve traversals.
   */
  boolean isInitialized();

  /**
   * Run one bounded-depth traversal.
   *
   * @param anchorId node identifier, node name, or a short natural-language query naming the anchor
   * @param maxDepth maximum number of hops (1-7)
   * @param domainFilter only return paths ending in this domain; {@code null} disables the filter
   * @param versionConstraint point-in-time selector resolved by the store; may be {@code null}
   * @return raw paths, empty when nothing matched
   * @throws GraphStoreException when the store is unreachable, errors, or returns unreadable data
   */
  List<GraphPath> traverse(
      String anchorId, int maxDepth, String domainFilter, VersionConstraint versionConstraint);

  /**
   * @return logical store identifier (e.g., {@code arangodb}).
   */
  String getStoreName();

  /** Release connections and resources. */
  void shutdown();

  @Override
  default void close() {
    shutdown();
  }
}
