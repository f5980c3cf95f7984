package com.marketfeed.stream.port;

import java.time.Duration;

public record RateLimitRule(int maxRequests, Duration window) {}
