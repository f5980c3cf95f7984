package com.marketfeed.stream.error;

public class RateLimitedException extends StreamException {
  public static final String CODE = "RATE_LIMITED";

  private final String clientId;
  private final long retryAfterSeconds;

  public RateLimitedException(String clientId, long retryAfterSeconds) {
    super(CODE, "Connection rate limit exceeded for client " + clientId);
    this.clientId = clientId;
    this.retryAfterSeconds = retryAfterSeconds;
  }

  public String clientId() {
    return clientId;
  }

  public long retryAfterSeconds() {
    return retryAfterSeconds;
  }
}
