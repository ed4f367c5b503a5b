package com.flamingo.ai.deconstructor.exception;

/** Exception thrown when the summarization model is unavailable. */
public class LlmServiceException extends RuntimeException {

  private final boolean rateLimited;
  private final String userMessage;

  public LlmServiceException(String message, Throwable cause) {
    super(message, cause);
    this.rateLimited = isRateLimit(cause);
    this.userMessage =
        rateLimited
            ? "Service is temporarily busy. Please try again in a moment."
            : "AI service is temporarily unavailable. Please try again later.";
  }

  public boolean isRateLimited() {
    return rateLimited;
  }

  public String getUserMessage() {
    return userMessage;
  }

  private static boolean isRateLimit(Throwable cause) {
    return cause != null
        && cause.getMessage() != null
        && (cause.getMessage().contains("429") || cause.getMessage().contains("rate limit"));
  }
}
