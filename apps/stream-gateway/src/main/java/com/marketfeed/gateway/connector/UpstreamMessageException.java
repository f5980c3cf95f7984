package com.marketfeed.gateway.connector;

public class UpstreamMessageException extends RuntimeException {
  private final String code;

  public UpstreamMessageException(String code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public String code() {
    return code;
  }
}
