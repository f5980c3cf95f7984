package com.marketfeed.stream.batch;

public record BatchStats(
    long totalBatches,
    long totalQuotes,
    long totalProcessingTimeMs,
    double averageProcessingTimeMs,
    long totalFallbacks,
    long partialRecoverySuccess,
    long currentIntervalMs) {}
