package com.flamingo.ai.deconstructor.api.dto.response;

import com.flamingo.ai.deconstructor.segmentation.model.SectionMap;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a segmented paper. Sections are listed in canonical order. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SectionMapResponse {

  private String documentName;
  private int lineCount;
  private List<SectionResponse> sections;

  /** Creates a SectionMapResponse from a section map. */
  public static SectionMapResponse fromSectionMap(String documentName, SectionMap sectionMap) {
    return SectionMapResponse.builder()
        .documentName(documentName)
        .lineCount(sectionMap.lineCount())
        .sections(sectionMap.asMap().values().stream().map(SectionResponse::fromSpan).toList())
        .build();
  }
}
