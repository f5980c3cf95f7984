package com.marketfeed.stream.batch;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.marketfeed.stream.error.CircuitOpenException;
import com.marketfeed.stream.observability.MicrometerStreamTelemetry;
import com.marketfeed.stream.testing.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class CircuitBreakerTest {
  private final MutableClock clock = MutableClock.startingAt("2026-02-25T12:00:00Z");
  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

  @Test
  void shouldStayClosedBeforeMinimumAttempts() {
    CircuitBreaker breaker = breaker(50.0);
    for (int i = 0; i < 9; i++) {
      breaker.acquirePermission();
      breaker.recordFailure();
    }

    assertDoesNotThrow(breaker::acquirePermission);
    assertFalse(breaker.isOpen());
  }

  @Test
  void shouldOpenOnceFailureRatioReachesThreshold() {
    CircuitBreaker breaker = breaker(52.0);
    for (int i = 0; i < 5; i++) {
      breaker.acquirePermission();
      breaker.recordSuccess();
      breaker.acquirePermission();
      breaker.recordFailure();
    }
    breaker.acquirePermission();
    breaker.recordFailure();

    CircuitOpenException error = assertThrows(CircuitOpenException.class, breaker::acquirePermission);

    assertEquals(6L, error.failures());
    assertEquals(5L, error.successes());
    assertTrue(breaker.snapshot().open());
    assertEquals(
        1.0d,
        registry
            .get("stream.circuit_breaker.transition.total")
            .tag("state", "open")
            .counter()
            .count());
  }

  @Test
  void shouldResetAfterCoolDownElapsed() {
    CircuitBreaker breaker = breaker(50.0);
    for (int i = 0; i < 10; i++) {
      breaker.recordFailure();
    }
    assertThrows(CircuitOpenException.class, breaker::acquirePermission);

    clock.advance(Duration.ofSeconds(30));
    assertThrows(CircuitOpenException.class, breaker::acquirePermission);

    clock.advance(Duration.ofMillis(1));
    assertDoesNotThrow(breaker::acquirePermission);

    CircuitBreakerState state = breaker.snapshot();
    assertFalse(state.open());
    assertEquals(0L, state.failures());
    assertEquals(0L, state.successes());
  }

  @Test
  void shouldHalveCountersBeforeTheyGrowUnbounded() {
    CircuitBreaker breaker = breaker(50.0);
    breaker.recordFailure();
    breaker.recordFailure();
    for (int i = 0; i < 1001; i++) {
      breaker.recordSuccess();
    }

    CircuitBreakerState state = breaker.snapshot();
    assertEquals(500L, state.successes());
    assertEquals(1L, state.failures());
  }

  @Test
  void shouldRejectInvalidThreshold() {
    assertThrows(IllegalArgumentException.class, () -> breaker(0.0));
    assertThrows(IllegalArgumentException.class, () -> breaker(120.0));
  }

  private CircuitBreaker breaker(double threshold) {
    return new CircuitBreaker(
        threshold, Duration.ofSeconds(30), new MicrometerStreamTelemetry(registry), clock);
  }
}
