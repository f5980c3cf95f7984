package com.marketfeed.stream.batch;

import java.util.concurrent.atomic.AtomicLong;

/** Counters updated concurrently by group workers. */
final class BatchStatistics {
  private final AtomicLong totalBatches = new AtomicLong();
  private final AtomicLong totalQuotes = new AtomicLong();
  private final AtomicLong totalProcessingTimeMs = new AtomicLong();
  private final AtomicLong totalFallbacks = new AtomicLong();
  private final AtomicLong partialRecoverySuccess = new AtomicLong();

  void recordBatch(int quotes, long processingTimeMs) {
    totalBatches.incrementAndGet();
    totalQuotes.addAndGet(quotes);
    totalProcessingTimeMs.addAndGet(Math.max(0L, processingTimeMs));
  }

  void recordFallback(boolean partiallyRecovered) {
    totalFallbacks.incrementAndGet();
    if (partiallyRecovered) {
      partialRecoverySuccess.incrementAndGet();
    }
  }

  BatchStats snapshot(long currentIntervalMs) {
    long batches = totalBatches.get();
    long processingTime = totalProcessingTimeMs.get();
    return new BatchStats(
        batches,
        totalQuotes.get(),
        processingTime,
        batches == 0 ? 0.0 : (double) processingTime / batches,
        totalFallbacks.get(),
        partialRecoverySuccess.get(),
        currentIntervalMs);
  }
}
