package com.marketfeed.stream.port;

public interface RateLimitGateway {
  RateLimitDecision checkRateLimit(String key, RateLimitRule rule);
}
