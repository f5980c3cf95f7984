package com.marketfeed.stream.batch;

public record IntervalAdjustment(
    long previousIntervalMs, long currentIntervalMs, double averageBatchesPerSecond) {}
