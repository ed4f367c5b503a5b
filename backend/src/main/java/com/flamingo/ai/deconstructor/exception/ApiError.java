package com.flamingo.ai.deconstructor.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String DOCUMENT_PARSE_ERROR = "DOCUMENT_001";
  public static final String DOCUMENT_EMPTY = "DOCUMENT_002";
  public static final String SECTION_UNKNOWN = "SECTION_001";
  public static final String SUMMARY_EMPTY_INPUT = "SUMMARY_001";
  public static final String SUMMARY_INVALID_LENGTH = "SUMMARY_002";
  public static final String LLM_UNAVAILABLE = "LLM_001";
  public static final String LLM_RATE_LIMITED = "LLM_002";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
