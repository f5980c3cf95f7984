package com.marketfeed.stream.batch;

import java.util.List;

public record BatchOutcome(int batchSize, List<GroupOutcome> groups, long durationMs) {
  public BatchOutcome {
    groups = groups == null ? List.of() : List.copyOf(groups);
  }

  static BatchOutcome empty() {
    return new BatchOutcome(0, List.of(), 0L);
  }

  public long fallbackCount() {
    return groups.stream().filter(group -> group.status() == GroupOutcome.Status.FALLBACK).count();
  }

  public boolean degraded() {
    return fallbackCount() > 0;
  }
}
