package com.flamingo.ai.deconstructor.service.report;

import java.util.List;

/**
 * Sections to include in a report and the summary length bounds.
 *
 * @param sections request keys: canonical section keys, {@code summary} or {@code all}
 * @param minLength lower word bound for summaries, or {@code null} for the configured default
 * @param maxLength upper word bound for summaries, or {@code null} for the configured default
 */
public record ReportRequest(List<String> sections, Integer minLength, Integer maxLength) {

  public ReportRequest {
    sections = sections == null ? List.of() : List.copyOf(sections);
  }
}
