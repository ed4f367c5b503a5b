package com.flamingo.ai.deconstructor.segmentation.model;

/** How a {@link SectionSpan} was located. */
public enum SpanOrigin {
  /** Bounded by a resolved heading line. */
  HEADING,
  /** Inferred from position (the title block before the first heading). */
  POSITIONAL,
  /** Assembled from cue-phrase sentences; overlaps the spans it was drawn from. */
  CUE_PHRASE,
  /** Opening abstract sentences used when no cue phrase matched; overlaps the abstract. */
  ABSTRACT_FALLBACK;

  /** Whether spans of this origin partition the document rather than quote from it. */
  public boolean isPartition() {
    return this == HEADING || this == POSITIONAL;
  }
}
