package com.marketfeed.stream.error;

public class StreamException extends RuntimeException {
  private final String code;

  public StreamException(String code, String message) {
    super(message);
    this.code = code;
  }

  public StreamException(String code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public String code() {
    return code;
  }
}
