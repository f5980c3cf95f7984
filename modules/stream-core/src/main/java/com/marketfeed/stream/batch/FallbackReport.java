package com.marketfeed.stream.batch;

/** What the fallback path did for one degraded group. */
public record FallbackReport(
    String provider,
    String capability,
    String reason,
    int batchSize,
    FallbackAnalysis analysis,
    PartialRecoveryResult partialRecovery,
    String errorMessage) {}
