package com.marketfeed.stream.batch;

import java.time.Instant;

public record CircuitBreakerState(
    long failures, long successes, Instant lastFailureTime, boolean open) {}
