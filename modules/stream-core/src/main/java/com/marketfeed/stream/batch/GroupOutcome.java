package com.marketfeed.stream.batch;

import com.marketfeed.stream.connection.ConnectionKey;
import com.marketfeed.stream.pipeline.PipelineReport;

/** Result of one (provider, capability) group. Exactly one of report and fallback is set. */
public record GroupOutcome(
    ConnectionKey key,
    int size,
    Status status,
    int attempts,
    PipelineReport report,
    FallbackReport fallback) {

  public enum Status {
    PROCESSED,
    DROPPED,
    FALLBACK
  }

  static GroupOutcome completed(ConnectionKey key, int size, int attempts, PipelineReport report) {
    Status status = report.dropped() ? Status.DROPPED : Status.PROCESSED;
    return new GroupOutcome(key, size, status, attempts, report, null);
  }

  static GroupOutcome fallback(ConnectionKey key, int size, int attempts, FallbackReport fallback) {
    return new GroupOutcome(key, size, Status.FALLBACK, attempts, null, fallback);
  }
}
