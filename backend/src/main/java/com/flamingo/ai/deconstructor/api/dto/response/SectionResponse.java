package com.flamingo.ai.deconstructor.api.dto.response;

import com.flamingo.ai.deconstructor.segmentation.model.SectionSpan;
import com.flamingo.ai.deconstructor.segmentation.model.SpanOrigin;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for one extracted section. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SectionResponse {

  private String key;
  private String heading;
  private int startLine;
  private int endLine;
  private SpanOrigin origin;
  private boolean lowConfidence;
  private String text;

  /** Creates a SectionResponse from a section span. */
  public static SectionResponse fromSpan(SectionSpan span) {
    return SectionResponse.builder()
        .key(span.name().key())
        .heading(span.name().displayName())
        .startLine(span.startLine())
        .endLine(span.endLine())
        .origin(span.origin())
        .lowConfidence(span.lowConfidence())
        .text(span.text())
        .build();
  }
}
