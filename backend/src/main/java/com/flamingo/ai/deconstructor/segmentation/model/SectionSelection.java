package com.flamingo.ai.deconstructor.segmentation.model;

/**
 * One entry of a section request resolved against a {@link SectionMap}.
 *
 * @param key request key ({@code summary} or a canonical section key)
 * @param section the canonical section, or {@code null} for the whole-document {@code summary}
 * @param status whether the section was found
 * @param text section text, or {@code null} when not found
 * @param lowConfidence whether the text comes from a fallback heuristic
 */
public record SectionSelection(
    String key,
    CanonicalSection section,
    SelectionStatus status,
    String text,
    boolean lowConfidence) {

  public static final String SUMMARY_KEY = "summary";
  public static final String ALL_KEY = "all";

  public static SectionSelection found(SectionSpan span) {
    return new SectionSelection(
        span.name().key(), span.name(), SelectionStatus.FOUND, span.text(), span.lowConfidence());
  }

  public static SectionSelection notFound(CanonicalSection section) {
    return new SectionSelection(
        section.key(), section, SelectionStatus.SECTION_NOT_FOUND, null, false);
  }

  public static SectionSelection wholeDocument(String documentText) {
    return new SectionSelection(SUMMARY_KEY, null, SelectionStatus.FOUND, documentText, false);
  }

  public boolean isFound() {
    return status == SelectionStatus.FOUND;
  }

  public boolean isWholeDocument() {
    return section == null;
  }
}
