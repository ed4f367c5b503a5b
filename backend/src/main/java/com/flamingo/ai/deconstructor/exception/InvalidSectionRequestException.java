package com.flamingo.ai.deconstructor.exception;

/** Exception thrown when a section request is empty or names an unknown section. */
public class InvalidSectionRequestException extends RuntimeException {

  private final String requestedKey;

  public InvalidSectionRequestException(String requestedKey) {
    super("Unknown section: " + requestedKey);
    this.requestedKey = requestedKey;
  }

  private InvalidSectionRequestException(String message, String requestedKey) {
    super(message);
    this.requestedKey = requestedKey;
  }

  public static InvalidSectionRequestException noSectionsRequested() {
    return new InvalidSectionRequestException("At least one section must be requested", null);
  }

  public String getRequestedKey() {
    return requestedKey;
  }
}
