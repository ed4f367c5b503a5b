package com.flamingo.ai.deconstructor.service.segmentation;

import com.flamingo.ai.deconstructor.exception.SegmentationErrorCode;
import com.flamingo.ai.deconstructor.segmentation.model.SectionMap;

/**
 * Outcome of segmenting one document of a batch: either a section map or the failure code.
 *
 * @param documentName document name
 * @param sectionMap the section map, or {@code null} on failure
 * @param errorCode failure code, or {@code null} on success
 */
public record BatchSegmentationResult(
    String documentName, SectionMap sectionMap, SegmentationErrorCode errorCode) {

  public static BatchSegmentationResult success(String documentName, SectionMap sectionMap) {
    return new BatchSegmentationResult(documentName, sectionMap, null);
  }

  public static BatchSegmentationResult failure(
      String documentName, SegmentationErrorCode errorCode) {
    return new BatchSegmentationResult(documentName, null, errorCode);
  }

  public boolean isSuccess() {
    return sectionMap != null;
  }
}
