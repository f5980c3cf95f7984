package com.marketfeed.stream.connection;

import java.util.Locale;

public enum ConnectionQuality {
  POOR(1),
  GOOD(2),
  EXCELLENT(3);

  private final int priority;

  ConnectionQuality(int priority) {
    this.priority = priority;
  }

  /** Lower values are evicted first. */
  public int priority() {
    return priority;
  }

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }
}
