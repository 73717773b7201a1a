package com.gentoro.pathrag.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Deterministic cache key derived from named request parameters.
 *
 * <p>Parameters are sorted by name and rendered as {@code name=value|name=value}; {@code null}
 * values render as {@code -}. The key used by the tiers is the SHA-256 hex digest of that string,
 * which keeps it filesystem-safe for the persistent tier.
 */
public final class CacheKey {
  private static final String NULL_VALUE = "-";

  private final String description;
  private final String value;

  private CacheKey(String description) {
    this.description = description;
    this.value = sha256(description);
  }

  public static CacheKey of(Map<String, ?> parameters) {
    Objects.requireNonNull(parameters, "parameters");
    StringBuilder sb = new StringBuilder();
    new TreeMap<>(parameters)
        .forEach(
            (name, v) -> {
              if (sb.length() > 0) sb.append('|');
              sb.append(name).append('=').append(v == null ? NULL_VALUE : escape(v.toString()));
            });
    return new CacheKey(sb.toString());
  }

  /** Digest used as the tier key. */
  public String value() {
    return value;
  }

  /** Human-readable form, for logs. */
  public String description() {
    return description;
  }

  /** SHA-256 hex digest of {@code text}. */
  public static String sha256(String text) {
    try {
      MessageDigest md = MessageDigest.getInstance("SHA-256");
      byte[] digest = md.digest(text.getBytes(StandardCharsets.UTF_8));
      StringBuilder hex = new StringBuilder(digest.length * 2);
      for (byte b : digest) {
        hex.append(String.format("%02x", b));
      }
      return hex.toString();
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  private static String escape(String v) {
    return v.replace("\\", "\\\\").replace("|", "\\|").replace("=", "\\=");
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof CacheKey other)) return false;
    return value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public String toString() {
    return description;
  }
}
