package com.flamingo.ai.deconstructor.api.dto.response;

import com.flamingo.ai.deconstructor.service.report.PaperReport;
import com.flamingo.ai.deconstructor.service.report.ReportEntry;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a paper report, structured entries plus the rendered Markdown. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaperReportResponse {

  private String documentName;
  private String title;
  private List<ReportEntry> entries;
  private String markdown;

  /** Creates a PaperReportResponse from a report and its rendering. */
  public static PaperReportResponse fromReport(PaperReport report, String markdown) {
    return PaperReportResponse.builder()
        .documentName(report.documentName())
        .title(report.title())
        .entries(report.entries())
        .markdown(markdown)
        .build();
  }
}
