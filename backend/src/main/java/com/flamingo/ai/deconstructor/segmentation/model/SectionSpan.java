package com.flamingo.ai.deconstructor.segmentation.model;

/**
 * A contiguous run of document lines assigned to one canonical section.
 *
 * <p>For {@link SpanOrigin#HEADING} spans, {@code startLine} is the heading line itself, which is
 * excluded from {@code text}. Contribution spans record the range that was scanned and may overlap
 * heading spans.
 *
 * @param name canonical section
 * @param startLine first line index (inclusive)
 * @param endLine last line index (exclusive)
 * @param text extracted text
 * @param origin how the span was located
 * @param lowConfidence set when the text comes from a fallback heuristic
 */
public record SectionSpan(
    CanonicalSection name,
    int startLine,
    int endLine,
    String text,
    SpanOrigin origin,
    boolean lowConfidence) {

  public static SectionSpan heading(
      CanonicalSection name, int startLine, int endLine, String text) {
    return new SectionSpan(name, startLine, endLine, text, SpanOrigin.HEADING, false);
  }

  public boolean overlaps(SectionSpan other) {
    return startLine < other.endLine && other.startLine < endLine;
  }
}
