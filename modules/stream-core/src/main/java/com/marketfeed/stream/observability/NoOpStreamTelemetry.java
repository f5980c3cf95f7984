package com.marketfeed.stream.observability;

import com.marketfeed.stream.batch.FallbackReport;
import com.marketfeed.stream.pipeline.PipelineErrorCategory;
import com.marketfeed.stream.pipeline.PipelineReport;
import com.marketfeed.stream.port.RecoveryPriority;
import java.util.function.Supplier;

public class NoOpStreamTelemetry implements StreamTelemetry {
    @Override
    public void bindActiveConnections(Supplier<Number> activeConnections) {
    }

    @Override
    public void onConnectionOpened(String provider, String capability) {
    }

    @Override
    public void onConnectionClosed(String provider, String capability, String reason) {
    }

    @Override
    public void onConnectionRejected(String provider, String capability, String reason) {
    }

    @Override
    public void onRateLimitCheck(String outcome) {
    }

    @Override
    public void onMemoryPressure(String level, long heapUsedBytes) {
    }

    @Override
    public void onBatchProcessed(int batchSize, int groupCount, long durationNanos) {
    }

    @Override
    public void onBatchIntervalAdjusted(
            long previousIntervalMs, long currentIntervalMs, double averageLoad) {
    }

    @Override
    public void onPipelineCompleted(PipelineReport report) {
    }

    @Override
    public void onPipelineFailure(
            String provider, String capability, PipelineErrorCategory category) {
    }

    @Override
    public void onCircuitBreakerStateChange(boolean open) {
    }

    @Override
    public void onFallback(FallbackReport report) {
    }

    @Override
    public void onReconnect(String outcome) {
    }

    @Override
    public void onRecoveryJobSubmitted(RecoveryPriority priority) {
    }
}
