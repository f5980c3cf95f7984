package com.marketfeed.stream.error;

public class ResourceExhaustedException extends StreamException {
  public static final String CODE = "RESOURCE_EXHAUSTED";

  private final int limit;
  private final int current;

  public ResourceExhaustedException(String message, int limit, int current) {
    super(CODE, message);
    this.limit = limit;
    this.current = current;
  }

  public int limit() {
    return limit;
  }

  public int current() {
    return current;
  }
}
