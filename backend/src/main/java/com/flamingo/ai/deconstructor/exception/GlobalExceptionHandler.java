package com.flamingo.ai.deconstructor.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(DocumentProcessingException.class)
  public ResponseEntity<ApiError> handleDocumentProcessing(
      DocumentProcessingException ex, HttpServletRequest request) {

    incrementErrorCounter("document_processing");
    String errorId = generateErrorId();
    log.error(
        "Document processing error [{}] for '{}': {}",
        errorId,
        ex.getDocumentName(),
        ex.getMessage(),
        ex);

    return respond(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.DOCUMENT_PARSE_ERROR,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(SegmentationException.class)
  public ResponseEntity<ApiError> handleSegmentation(
      SegmentationException ex, HttpServletRequest request) {

    incrementErrorCounter("segmentation_" + ex.getErrorCode().name().toLowerCase());
    String errorId = generateErrorId();
    log.warn("Segmentation failed [{}]: {} {}", errorId, ex.getErrorCode(), ex.getMessage());

    return respond(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.DOCUMENT_EMPTY,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(InvalidSectionRequestException.class)
  public ResponseEntity<ApiError> handleInvalidSection(
      InvalidSectionRequestException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_section");
    String errorId = generateErrorId();
    log.warn("Invalid section request [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.BAD_REQUEST, errorId, ApiError.SECTION_UNKNOWN, ex.getMessage(), request);
  }

  @ExceptionHandler(SummarizationException.class)
  public ResponseEntity<ApiError> handleSummarization(
      SummarizationException ex, HttpServletRequest request) {

    incrementErrorCounter("summarization_" + ex.getReason().name().toLowerCase());
    String errorId = generateErrorId();
    log.warn("Summarization rejected [{}]: {}", errorId, ex.getMessage());

    String code =
        ex.getReason() == SummarizationException.Reason.EMPTY_INPUT
            ? ApiError.SUMMARY_EMPTY_INPUT
            : ApiError.SUMMARY_INVALID_LENGTH;
    return respond(HttpStatus.UNPROCESSABLE_ENTITY, errorId, code, ex.getMessage(), request);
  }

  @ExceptionHandler(LlmServiceException.class)
  public ResponseEntity<ApiError> handleLlmService(
      LlmServiceException ex, HttpServletRequest request) {

    String errorType = ex.isRateLimited() ? "llm_rate_limited" : "llm_error";
    incrementErrorCounter(errorType);
    String errorId = generateErrorId();
    log.error("LLM service error [{}]: {}", errorId, ex.getMessage(), ex);

    String code = ex.isRateLimited() ? ApiError.LLM_RATE_LIMITED : ApiError.LLM_UNAVAILABLE;
    return respond(HttpStatus.SERVICE_UNAVAILABLE, errorId, code, ex.getUserMessage(), request);
  }

  @ExceptionHandler({
    MissingServletRequestPartException.class,
    MissingServletRequestParameterException.class
  })
  public ResponseEntity<ApiError> handleMissingInput(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Validation error [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, ex.getMessage(), request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> respond(
      HttpStatus status,
      String errorId,
      String code,
      String message,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
