package com.flamingo.ai.deconstructor.segmentation.model;

/** Outcome of looking up one requested section. */
public enum SelectionStatus {
  FOUND,
  SECTION_NOT_FOUND
}
