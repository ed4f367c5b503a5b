package com.flamingo.ai.deconstructor.segmentation.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Structural roles a research paper's content can play, independent of the paper's own heading
 * wording.
 *
 * <p>Declaration order is the canonical report order: a {@link SectionMap} always iterates its
 * entries in this order, not in detection order.
 */
public enum CanonicalSection {
  TITLE("title", "Title"),
  ABSTRACT("abstract", "Abstract"),
  INTRODUCTION("introduction", "Introduction"),
  METHOD("method", "Method"),
  RESULTS("results", "Results"),
  CONCLUSION("conclusion", "Conclusion"),
  CONTRIBUTION("contribution", "Contribution"),
  LITERATURE_REVIEW("literature_review", "Literature review"),
  REFERENCES("references", "References");

  private final String key;
  private final String displayName;

  CanonicalSection(String key, String displayName) {
    this.key = key;
    this.displayName = displayName;
  }

  /** Request key, e.g. {@code literature_review}. */
  public String key() {
    return key;
  }

  /** Human-readable heading used in rendered reports. */
  public String displayName() {
    return displayName;
  }

  /** Virtual sections never carry an explicit heading and are inferred after resolution. */
  public boolean isVirtual() {
    return this == TITLE || this == CONTRIBUTION;
  }

  public static Optional<CanonicalSection> fromKey(String key) {
    if (key == null) {
      return Optional.empty();
    }
    String normalized = key.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values()).filter(s -> s.key.equals(normalized)).findFirst();
  }
}
