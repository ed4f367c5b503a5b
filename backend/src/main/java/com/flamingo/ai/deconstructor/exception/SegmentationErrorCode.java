package com.flamingo.ai.deconstructor.exception;

/** Error kinds raised or reported by the section segmentation pipeline. */
public enum SegmentationErrorCode {
  /** Nothing left after normalization. Fatal. */
  EMPTY_INPUT,
  /** A requested section has no resolved span. Reported per section, never thrown. */
  SECTION_NOT_FOUND,
  /** Several headings competed for one section. Logged only. */
  AMBIGUOUS_HEADING
}
