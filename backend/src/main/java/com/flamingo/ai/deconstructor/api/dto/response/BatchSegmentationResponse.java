package com.flamingo.ai.deconstructor.api.dto.response;

import com.flamingo.ai.deconstructor.exception.SegmentationErrorCode;
import com.flamingo.ai.deconstructor.service.segmentation.BatchSegmentationResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for one document of a batch: its section map or the failure code. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchSegmentationResponse {

  private String documentName;
  private boolean success;
  private SegmentationErrorCode errorCode;
  private SectionMapResponse sectionMap;

  /** Creates a BatchSegmentationResponse from a batch result. */
  public static BatchSegmentationResponse fromResult(BatchSegmentationResult result) {
    return BatchSegmentationResponse.builder()
        .documentName(result.documentName())
        .success(result.isSuccess())
        .errorCode(result.errorCode())
        .sectionMap(
            result.isSuccess()
                ? SectionMapResponse.fromSectionMap(result.documentName(), result.sectionMap())
                : null)
        .build();
  }
}
