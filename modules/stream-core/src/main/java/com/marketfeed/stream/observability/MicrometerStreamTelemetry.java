package com.marketfeed.stream.observability;

import com.marketfeed.stream.batch.BatchFallbackHandler;
import com.marketfeed.stream.batch.FallbackReport;
import com.marketfeed.stream.pipeline.PipelineErrorCategory;
import com.marketfeed.stream.pipeline.PipelineReport;
import com.marketfeed.stream.pipeline.PipelineStage;
import com.marketfeed.stream.port.RecoveryPriority;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

public class MicrometerStreamTelemetry implements StreamTelemetry {
  private final MeterRegistry meterRegistry;

  public MicrometerStreamTelemetry(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  @Override
  public void bindActiveConnections(Supplier<Number> activeConnections) {
    Gauge.builder("stream.connections.active", activeConnections)
        .description("Live upstream stream connections")
        .register(meterRegistry);
  }

  @Override
  public void onConnectionOpened(String provider, String capability) {
    connectionCounter(provider, capability, "opened", "none").increment();
  }

  @Override
  public void onConnectionClosed(String provider, String capability, String reason) {
    connectionCounter(provider, capability, "closed", reason).increment();
  }

  @Override
  public void onConnectionRejected(String provider, String capability, String reason) {
    connectionCounter(provider, capability, "rejected", reason).increment();
  }

  @Override
  public void onRateLimitCheck(String outcome) {
    Counter.builder("stream.ratelimit.check.total")
        .description("Connection rate-limit checks by outcome")
        .tag("outcome", safeValue(outcome))
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void onMemoryPressure(String level, long heapUsedBytes) {
    Counter.builder("stream.memory.pressure.total")
        .description("Heap checks above a configured threshold")
        .tag("level", safeValue(level))
        .register(meterRegistry)
        .increment();
    DistributionSummary.builder("stream.memory.heap_used")
        .description("Heap usage observed when a memory threshold was crossed")
        .baseUnit("bytes")
        .tag("level", safeValue(level))
        .register(meterRegistry)
        .record(Math.max(0L, heapUsedBytes));
  }

  @Override
  public void onBatchProcessed(int batchSize, int groupCount, long durationNanos) {
    Counter.builder("stream.batch.processed.total")
        .description("Drained batches handed to processing")
        .register(meterRegistry)
        .increment();
    DistributionSummary.builder("stream.batch.size")
        .description("Raw updates per drained batch")
        .register(meterRegistry)
        .record(Math.max(0, batchSize));
    Timer.builder("stream.batch.duration")
        .description("Batch processing latency across all groups")
        .register(meterRegistry)
        .record(Math.max(0L, durationNanos), TimeUnit.NANOSECONDS);
  }

  @Override
  public void onBatchIntervalAdjusted(
      long previousIntervalMs, long currentIntervalMs, double averageLoad) {
    Counter.builder("stream.batch.interval.adjustment.total")
        .description("Adaptive batch window adjustments")
        .tag("direction", currentIntervalMs < previousIntervalMs ? "shrink" : "grow")
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void onPipelineCompleted(PipelineReport report) {
    String provider = safeValue(report.provider());
    String capability = safeValue(report.capability());
    recordStage(provider, capability, PipelineStage.TRANSFORM.code(), report.transformMs());
    recordStage(
        provider, capability, PipelineStage.SYMBOL_STANDARDIZATION.code(), report.symbolMs());
    recordStage(provider, capability, PipelineStage.CACHE_WRITE.code(), report.cacheMs());
    recordStage(provider, capability, PipelineStage.BROADCAST.code(), report.broadcastMs());
    recordStage(provider, capability, "total", report.totalMs());

    Counter.builder("stream.pipeline.quotes.total")
        .description("Raw updates that completed the data pipeline")
        .tag("provider", provider)
        .tag("capability", capability)
        .tag("outcome", report.dropped() ? "dropped" : "processed")
        .register(meterRegistry)
        .increment(Math.max(0, report.quotesCount()));
    DistributionSummary.builder("stream.pipeline.throughput")
        .description("Data pipeline throughput in items per second")
        .tag("provider", provider)
        .tag("capability", capability)
        .register(meterRegistry)
        .record(report.throughputPerSecond());
  }

  @Override
  public void onPipelineFailure(
      String provider, String capability, PipelineErrorCategory category) {
    Counter.builder("stream.pipeline.failure.total")
        .description("Data pipeline attempts that failed")
        .tag("provider", safeValue(provider))
        .tag("capability", safeValue(capability))
        .tag("error_type", category == null ? "unknown_error" : category.code())
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void onCircuitBreakerStateChange(boolean open) {
    Counter.builder("stream.circuit_breaker.transition.total")
        .description("Circuit breaker state transitions")
        .tag("state", open ? "open" : "closed")
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void onFallback(FallbackReport report) {
    String trigger =
        BatchFallbackHandler.REASON_CIRCUIT_OPEN.equals(report.reason())
            ? "circuit_open"
            : "retries_exhausted";
    Counter.builder("stream.batch.fallback.total")
        .description("Groups degraded to fallback processing")
        .tag("trigger", trigger)
        .tag("partial_recovery", Boolean.toString(report.partialRecovery().attempted()))
        .register(meterRegistry)
        .increment();
    Counter.builder("stream.batch.fallback.quotes.total")
        .description("Raw updates handled by fallback processing")
        .tag("trigger", trigger)
        .register(meterRegistry)
        .increment(Math.max(0, report.batchSize()));
  }

  @Override
  public void onReconnect(String outcome) {
    Counter.builder("stream.reconnect.total")
        .description("Client reconnect requests by outcome")
        .tag("outcome", safeValue(outcome))
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void onRecoveryJobSubmitted(RecoveryPriority priority) {
    Counter.builder("stream.recovery.job.total")
        .description("Backfill jobs submitted to the recovery worker")
        .tag("priority", priority == null ? "unknown" : priority.code())
        .register(meterRegistry)
        .increment();
  }

  private Counter connectionCounter(
      String provider, String capability, String outcome, String reason) {
    return Counter.builder("stream.connection.total")
        .description("Upstream connection lifecycle events")
        .tag("provider", safeValue(provider))
        .tag("capability", safeValue(capability))
        .tag("outcome", outcome)
        .tag("reason", safeValue(reason))
        .register(meterRegistry);
  }

  private void recordStage(String provider, String capability, String stage, long durationMs) {
    Timer.builder("stream.pipeline.stage.duration")
        .description("Data pipeline stage latency")
        .tag("provider", provider)
        .tag("capability", capability)
        .tag("stage", stage)
        .register(meterRegistry)
        .record(Math.max(0L, durationMs), TimeUnit.MILLISECONDS);
  }

  private static String safeValue(String value) {
    if (value == null || value.isBlank()) {
      return "unknown";
    }
    return value;
  }
}
