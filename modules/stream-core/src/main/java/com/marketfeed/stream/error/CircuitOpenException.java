package com.marketfeed.stream.error;

/** Raised when the batch circuit breaker refuses an attempt. */
public class CircuitOpenException extends StreamException {
  public static final String CODE = "CIRCUIT_OPEN";

  private final long failures;
  private final long successes;

  public CircuitOpenException(long failures, long successes) {
    super(CODE, "Circuit breaker is open failures=" + failures + " successes=" + successes);
    this.failures = failures;
    this.successes = successes;
  }

  public long failures() {
    return failures;
  }

  public long successes() {
    return successes;
  }
}
