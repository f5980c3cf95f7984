package com.marketfeed.stream.observability;

import com.marketfeed.stream.batch.FallbackReport;
import com.marketfeed.stream.pipeline.PipelineErrorCategory;
import com.marketfeed.stream.pipeline.PipelineReport;
import com.marketfeed.stream.port.RecoveryPriority;
import java.util.function.Supplier;

public interface StreamTelemetry {
  void bindActiveConnections(Supplier<Number> activeConnections);

  void onConnectionOpened(String provider, String capability);

  void onConnectionClosed(String provider, String capability, String reason);

  void onConnectionRejected(String provider, String capability, String reason);

  void onRateLimitCheck(String outcome);

  void onMemoryPressure(String level, long heapUsedBytes);

  void onBatchProcessed(int batchSize, int groupCount, long durationNanos);

  void onBatchIntervalAdjusted(long previousIntervalMs, long currentIntervalMs, double averageLoad);

  void onPipelineCompleted(PipelineReport report);

  void onPipelineFailure(String provider, String capability, PipelineErrorCategory category);

  void onCircuitBreakerStateChange(boolean open);

  void onFallback(FallbackReport report);

  void onReconnect(String outcome);

  void onRecoveryJobSubmitted(RecoveryPriority priority);
}
