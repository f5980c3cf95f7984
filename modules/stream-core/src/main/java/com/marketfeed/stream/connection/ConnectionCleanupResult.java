package com.marketfeed.stream.connection;

public record ConnectionCleanupResult(int evicted, int remaining, long durationMs) {}
