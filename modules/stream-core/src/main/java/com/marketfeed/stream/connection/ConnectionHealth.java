package com.marketfeed.stream.connection;

import java.time.Duration;
import java.time.Instant;

public record ConnectionHealth(
    Instant lastActivity,
    int errorCount,
    int consecutiveErrors,
    boolean healthy,
    ConnectionQuality quality) {
  static final int MAX_CONSECUTIVE_ERRORS = 5;
  static final int MAX_ERRORS = 10;

  public static ConnectionHealth initial(Instant now) {
    return new ConnectionHealth(now, 0, 0, true, ConnectionQuality.EXCELLENT);
  }

  public ConnectionHealth withActivity(Instant activityAt) {
    Instant latest = latest(lastActivity, activityAt);
    return new ConnectionHealth(latest, errorCount, 0, healthy, quality);
  }

  public ConnectionHealth withError() {
    return new ConnectionHealth(
        lastActivity, errorCount + 1, consecutiveErrors + 1, healthy, quality);
  }

  public ConnectionHealth evaluate(Instant now, Duration staleTimeout) {
    Duration idle = Duration.between(lastActivity, now);
    boolean nowHealthy =
        idle.compareTo(staleTimeout) < 0
            && consecutiveErrors < MAX_CONSECUTIVE_ERRORS
            && errorCount < MAX_ERRORS;
    return new ConnectionHealth(
        lastActivity,
        errorCount,
        consecutiveErrors,
        nowHealthy,
        qualityOf(errorCount, consecutiveErrors, idle, staleTimeout));
  }

  /** The worse of the error grade and the recency grade. */
  static ConnectionQuality qualityOf(
      int errorCount, int consecutiveErrors, Duration idle, Duration staleTimeout) {
    ConnectionQuality byErrors = qualityOf(errorCount, consecutiveErrors);
    ConnectionQuality byRecency = recencyOf(idle, staleTimeout);
    return byRecency.priority() < byErrors.priority() ? byRecency : byErrors;
  }

  // idle under half the stale timeout is fresh, past 80% is about to be swept
  static ConnectionQuality recencyOf(Duration idle, Duration staleTimeout) {
    if (staleTimeout.isZero() || staleTimeout.isNegative()) {
      return ConnectionQuality.EXCELLENT;
    }
    long idleMs = Math.max(0L, idle.toMillis());
    long staleMs = staleTimeout.toMillis();
    if (idleMs * 10 >= staleMs * 8) {
      return ConnectionQuality.POOR;
    }
    if (idleMs * 2 >= staleMs) {
      return ConnectionQuality.GOOD;
    }
    return ConnectionQuality.EXCELLENT;
  }

  static ConnectionQuality qualityOf(int errorCount, int consecutiveErrors) {
    if (errorCount == 0 && consecutiveErrors == 0) {
      return ConnectionQuality.EXCELLENT;
    }
    if (consecutiveErrors <= 1 && errorCount <= 2) {
      return ConnectionQuality.GOOD;
    }
    return ConnectionQuality.POOR;
  }

  private static Instant latest(Instant current, Instant candidate) {
    if (candidate == null) {
      return current;
    }
    if (current == null || candidate.isAfter(current)) {
      return candidate;
    }
    return current;
  }
}
