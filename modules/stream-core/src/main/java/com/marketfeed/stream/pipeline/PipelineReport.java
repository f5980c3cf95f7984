package com.marketfeed.stream.pipeline;

import java.util.List;

/** Outcome of one data pipeline run for a (provider, capability) group. */
public record PipelineReport(
    String provider,
    String capability,
    int quotesCount,
    List<String> symbols,
    long transformMs,
    long symbolMs,
    long cacheMs,
    long broadcastMs,
    long totalMs,
    boolean dropped,
    double throughputPerSecond) {
  public PipelineReport {
    symbols = symbols == null ? List.of() : List.copyOf(symbols);
  }

  static PipelineReport dropped(
      String provider, String capability, int quotesCount, long transformMs, long totalMs) {
    return new PipelineReport(
        provider,
        capability,
        quotesCount,
        List.of(),
        transformMs,
        0L,
        0L,
        0L,
        totalMs,
        true,
        throughput(quotesCount, totalMs));
  }

  static double throughput(int quotesCount, long totalMs) {
    return quotesCount * 1000.0 / Math.max(1L, totalMs);
  }
}
