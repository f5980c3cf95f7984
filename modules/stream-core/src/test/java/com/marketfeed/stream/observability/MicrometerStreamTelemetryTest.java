package com.marketfeed.stream.observability;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.marketfeed.stream.batch.BatchFallbackHandler;
import com.marketfeed.stream.batch.FallbackAnalysis;
import com.marketfeed.stream.batch.FallbackReport;
import com.marketfeed.stream.batch.PartialRecoveryResult;
import com.marketfeed.stream.pipeline.PipelineErrorCategory;
import com.marketfeed.stream.port.RecoveryPriority;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class MicrometerStreamTelemetryTest {
  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private final MicrometerStreamTelemetry telemetry = new MicrometerStreamTelemetry(registry);

  @Test
  void shouldTrackActiveConnectionsThroughGauge() {
    AtomicInteger active = new AtomicInteger(3);
    telemetry.bindActiveConnections(active::get);

    active.set(5);

    assertEquals(5.0d, registry.get("stream.connections.active").gauge().value());
  }

  @Test
  void shouldTagConnectionEventsWithUnknownForBlankValues() {
    telemetry.onConnectionClosed("P", "ws-stock-quote", " ");

    assertEquals(
        1.0d,
        registry
            .get("stream.connection.total")
            .tag("outcome", "closed")
            .tag("reason", "unknown")
            .counter()
            .count());
  }

  @Test
  void shouldCountFallbackGroupsAndQuotes() {
    FallbackReport report =
        new FallbackReport(
            "P",
            "ws-stock-quote",
            BatchFallbackHandler.REASON_CIRCUIT_OPEN,
            4,
            new FallbackAnalysis(4, Set.of("700.HK"), Set.of("P"), Set.of("HK"), Set.of("q")),
            PartialRecoveryResult.skipped("circuit_open"),
            "open");

    telemetry.onFallback(report);

    assertEquals(
        1.0d,
        registry
            .get("stream.batch.fallback.total")
            .tag("trigger", "circuit_open")
            .tag("partial_recovery", "false")
            .counter()
            .count());
    assertEquals(4.0d, registry.get("stream.batch.fallback.quotes.total").counter().count());
  }

  @Test
  void shouldCountPipelineFailuresByCategory() {
    telemetry.onPipelineFailure("P", "ws-stock-quote", PipelineErrorCategory.TIMEOUT_ERROR);
    telemetry.onPipelineFailure("P", "ws-stock-quote", null);

    assertEquals(
        1.0d,
        registry
            .get("stream.pipeline.failure.total")
            .tag("error_type", "timeout_error")
            .counter()
            .count());
    assertEquals(
        1.0d,
        registry
            .get("stream.pipeline.failure.total")
            .tag("error_type", "unknown_error")
            .counter()
            .count());
  }

  @Test
  void shouldCountRecoveryJobsByPriority() {
    telemetry.onRecoveryJobSubmitted(RecoveryPriority.HIGH);
    telemetry.onRecoveryJobSubmitted(RecoveryPriority.HIGH);

    assertEquals(
        2.0d, registry.get("stream.recovery.job.total").tag("priority", "high").counter().count());
  }

  @Test
  void shouldTagIntervalAdjustmentsByDirection() {
    telemetry.onBatchIntervalAdjusted(50L, 10L, 140.0d);

    assertEquals(
        1.0d,
        registry
            .get("stream.batch.interval.adjustment.total")
            .tag("direction", "shrink")
            .counter()
            .count());
  }
}
