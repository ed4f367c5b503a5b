package com.flamingo.ai.deconstructor.service.report;

import com.flamingo.ai.deconstructor.config.DeconstructorConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Renders a {@link PaperReport} as a Markdown document. */
@Component
@RequiredArgsConstructor
public class MarkdownReportRenderer {

  static final String UNKNOWN_TITLE = "Unknown Paper";
  static final String NOT_FOUND_NOTE = "_Section not found in the document._";
  static final String LOW_CONFIDENCE_NOTE =
      "_No explicit contribution statement was found; this is the opening of the abstract._";
  static final String FOOTER = "---\n*Report generated by the Paper Deconstructor.*\n";

  private final DeconstructorConfig deconstructorConfig;

  public String render(PaperReport report) {
    StringBuilder md = new StringBuilder();
    String title =
        report.title() != null && !report.title().isBlank() ? report.title() : UNKNOWN_TITLE;
    md.append("# Analysis of ").append(title).append("\n\n");

    for (ReportEntry entry : report.entries()) {
      if (!entry.isFound()) {
        if (deconstructorConfig.getReport().isIncludeMissingSections()) {
          md.append("## ").append(entry.heading()).append('\n');
          md.append(NOT_FOUND_NOTE).append("\n\n");
        }
        continue;
      }
      md.append("## ").append(entry.heading()).append('\n');
      md.append(entry.content()).append("\n\n");
      if (entry.lowConfidence()) {
        md.append(LOW_CONFIDENCE_NOTE).append("\n\n");
      }
    }

    md.append(FOOTER);
    return md.toString();
  }
}
