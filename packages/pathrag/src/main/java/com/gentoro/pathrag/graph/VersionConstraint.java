package com.gentoro.pathrag.graph;

/**
 * Point-in-time selector handed through to the graph store unvalidated.
 *
 * <p>Either a version identifier ({@code asOfVersion}) or a timestamp ({@code asOfTimestamp}). The
 * engine only uses it to build cache keys and to echo it back; resolution belongs to the store.
 */
public record VersionConstraint(Kind kind, String value) {

  public enum Kind {
    VERSION,
    TIMESTAMP
  }

  public VersionConstraint {
    if (kind == null) {
      throw new IllegalArgumentException("kind cannot be null");
    }
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("version constraint value cannot be empty");
    }
  }

  public static VersionConstraint asOfVersion(String version) {
    return new VersionConstraint(Kind.VERSION, version);
  }

  public static VersionConstraint asOfTimestamp(String timestamp) {
    return new VersionConstraint(Kind.TIMESTAMP, timestamp);
  }

  @Override
  public String toString() {
    return kind.name().toLowerCase() + ":" + value;
  }
}
