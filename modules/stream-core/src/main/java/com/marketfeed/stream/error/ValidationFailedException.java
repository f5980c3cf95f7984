package com.marketfeed.stream.error;

public class ValidationFailedException extends StreamException {
  public static final String CODE = "DATA_VALIDATION_FAILED";

  public ValidationFailedException(String message) {
    super(CODE, message);
  }
}
