package com.marketfeed.stream.port;

public record RateLimitDecision(boolean allowed, int limit, long current, long retryAfterSeconds) {
  public static RateLimitDecision allow(int limit, long current) {
    return new RateLimitDecision(true, limit, current, 0L);
  }
}
