package com.flamingo.ai.deconstructor.service.report;

import java.util.List;

/**
 * Structured analysis of one paper, ready for rendering.
 *
 * @param documentName source document name
 * @param title extracted title, or {@code null} when none was found
 * @param entries one entry per requested section, in request order
 */
public record PaperReport(String documentName, String title, List<ReportEntry> entries) {

  public PaperReport {
    entries = List.copyOf(entries);
  }
}
