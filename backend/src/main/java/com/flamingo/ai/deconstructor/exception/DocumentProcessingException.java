package com.flamingo.ai.deconstructor.exception;

/** Exception thrown when text cannot be extracted from an uploaded paper. */
public class DocumentProcessingException extends RuntimeException {

  private final String documentName;
  private final String userMessage;

  public DocumentProcessingException(String documentName, String message) {
    super(message);
    this.documentName = documentName;
    this.userMessage = "Failed to read document";
  }

  public DocumentProcessingException(String documentName, String message, Throwable cause) {
    super(message, cause);
    this.documentName = documentName;
    this.userMessage = "Failed to read document";
  }

  public String getDocumentName() {
    return documentName;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
