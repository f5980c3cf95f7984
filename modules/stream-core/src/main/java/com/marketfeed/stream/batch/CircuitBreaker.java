package com.marketfeed.stream.batch;

import com.marketfeed.stream.error.CircuitOpenException;
import com.marketfeed.stream.observability.StreamTelemetry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binary open/closed breaker shared by every group of the batch pipeline. The state is evaluated
 * when an attempt starts: once {@value #MIN_ATTEMPTS} attempts have been recorded and the failure
 * percentage reaches the threshold the breaker opens; after the reset timeout has elapsed since the
 * last failure the counters are cleared and the attempt proceeds.
 */
public class CircuitBreaker {
  private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

  static final int MIN_ATTEMPTS = 10;
  static final long RESCALE_AFTER_SUCCESSES = 1000L;

  private final double thresholdPercent;
  private final Duration resetTimeout;
  private final StreamTelemetry telemetry;
  private final Clock clock;

  private long failures;
  private long successes;
  private Instant lastFailureTime;
  private boolean open;

  public CircuitBreaker(double thresholdPercent, Duration resetTimeout, StreamTelemetry telemetry) {
    this(thresholdPercent, resetTimeout, telemetry, Clock.systemUTC());
  }

  CircuitBreaker(
      double thresholdPercent, Duration resetTimeout, StreamTelemetry telemetry, Clock clock) {
    if (thresholdPercent <= 0.0 || thresholdPercent > 100.0) {
      throw new IllegalArgumentException("thresholdPercent must be in (0, 100]");
    }
    this.thresholdPercent = thresholdPercent;
    this.resetTimeout = Objects.requireNonNull(resetTimeout, "resetTimeout must not be null");
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  /** Throws {@link CircuitOpenException} when the attempt must be short-circuited. */
  public synchronized void acquirePermission() {
    Instant now = clock.instant();
    if (open) {
      if (lastFailureTime != null
          && Duration.between(lastFailureTime, now).compareTo(resetTimeout) > 0) {
        reset();
        log.info("Circuit breaker reset after cool-down resetTimeoutMs={}", resetTimeout.toMillis());
        telemetry.onCircuitBreakerStateChange(false);
      } else {
        throw new CircuitOpenException(failures, successes);
      }
    }

    long total = failures + successes;
    if (total >= MIN_ATTEMPTS && failurePercent() >= thresholdPercent) {
      open = true;
      lastFailureTime = now;
      log.warn(
          "Circuit breaker opened failures={} successes={} failurePercent={} thresholdPercent={}",
          failures,
          successes,
          String.format("%.1f", failurePercent()),
          thresholdPercent);
      telemetry.onCircuitBreakerStateChange(true);
      throw new CircuitOpenException(failures, successes);
    }
  }

  public synchronized void recordSuccess() {
    successes++;
    if (successes > RESCALE_AFTER_SUCCESSES) {
      successes /= 2;
      failures /= 2;
    }
  }

  public synchronized void recordFailure() {
    failures++;
    lastFailureTime = clock.instant();
  }

  public synchronized boolean isOpen() {
    return open;
  }

  public synchronized CircuitBreakerState snapshot() {
    return new CircuitBreakerState(failures, successes, lastFailureTime, open);
  }

  private void reset() {
    failures = 0;
    successes = 0;
    open = false;
  }

  private double failurePercent() {
    long total = failures + successes;
    return total == 0 ? 0.0 : failures * 100.0 / total;
  }
}
