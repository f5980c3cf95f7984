package com.marketfeed.stream.error;

public class CollaboratorUnavailableException extends StreamException {
  public static final String CODE = "COLLABORATOR_UNAVAILABLE";

  private final String collaborator;

  public CollaboratorUnavailableException(String collaborator, String message) {
    super(CODE, message);
    this.collaborator = collaborator;
  }

  public CollaboratorUnavailableException(String collaborator, String message, Throwable cause) {
    super(CODE, message, cause);
    this.collaborator = collaborator;
  }

  public String collaborator() {
    return collaborator;
  }
}
