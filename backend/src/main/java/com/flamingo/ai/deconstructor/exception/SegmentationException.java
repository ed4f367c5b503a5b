package com.flamingo.ai.deconstructor.exception;

/** Exception thrown when a document cannot be segmented at all. */
public class SegmentationException extends RuntimeException {

  private final SegmentationErrorCode errorCode;
  private final String userMessage;

  public SegmentationException(SegmentationErrorCode errorCode, String message) {
    super(message);
    this.errorCode = errorCode;
    this.userMessage = "The document contains no extractable text";
  }

  public SegmentationErrorCode getErrorCode() {
    return errorCode;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
