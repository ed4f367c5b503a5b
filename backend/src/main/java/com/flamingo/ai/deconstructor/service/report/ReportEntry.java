package com.flamingo.ai.deconstructor.service.report;

import com.flamingo.ai.deconstructor.segmentation.model.SelectionStatus;

/**
 * One section of a rendered report.
 *
 * @param key request key
 * @param heading display heading
 * @param status {@link SelectionStatus#SECTION_NOT_FOUND} when the paper has no such section
 * @param content verbatim or summarized text, {@code null} when not found
 * @param summarized whether {@code content} is a model summary
 * @param lowConfidence whether the extracted text came from a fallback heuristic
 */
public record ReportEntry(
    String key,
    String heading,
    SelectionStatus status,
    String content,
    boolean summarized,
    boolean lowConfidence) {

  public boolean isFound() {
    return status == SelectionStatus.FOUND;
  }
}
