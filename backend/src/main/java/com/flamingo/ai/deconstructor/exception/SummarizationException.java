package com.flamingo.ai.deconstructor.exception;

/** Exception thrown when the summarizer rejects its input or length bounds. */
public class SummarizationException extends RuntimeException {

  /** Why the summarizer refused the request. */
  public enum Reason {
    EMPTY_INPUT,
    INVALID_LENGTH
  }

  private final Reason reason;

  public SummarizationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public Reason getReason() {
    return reason;
  }
}
