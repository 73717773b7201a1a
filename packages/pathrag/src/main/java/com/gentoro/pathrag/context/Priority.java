package com.gentoro.pathrag.context;

/** Fragment bucket. Declaration order is output order; eviction runs in reverse. */
public enum Priority {
  HIGH,
  MEDIUM,
  LOW;

  public boolean isLowerThan(Priority other) {
    return ordinal() > other.ordinal();
  }
}
