package com.flamingo.ai.deconstructor.segmentation;

import java.util.List;
import lombok.Builder;

/**
 * Immutable settings shared by every stage of the segmentation pipeline.
 *
 * <p>Passed explicitly into each component so alternate alias sets and thresholds (for example
 * for papers in another language) can be exercised without touching global state.
 *
 * @param aliasTable heading wordings per section
 * @param maxHeadingLength longest line, in characters, still considered a heading
 * @param minConfidence candidates scoring below this are discarded
 * @param minContentGap minimum number of content lines a heading must be followed by before the
 *     next candidate; headings with less are treated as false positives (table-of-contents runs)
 * @param contributionScopeFraction share of the document scanned for contribution sentences when
 *     neither abstract nor introduction was found
 * @param fallbackSentenceCount abstract sentences used as low-confidence contribution
 * @param contributionSeparator joins contribution sentences
 * @param maxPageNumberLength longest all-digit line treated as a page-number artifact
 * @param maxMetadataLineLength longest line considered for author-list detection
 * @param cuePhrases lower-case phrases marking a contribution sentence
 * @param metadataKeywords lower-case words marking affiliation or preprint lines in the title block
 */
@Builder(toBuilder = true)
public record SegmentationConfig(
    HeadingAliasTable aliasTable,
    int maxHeadingLength,
    double minConfidence,
    int minContentGap,
    double contributionScopeFraction,
    int fallbackSentenceCount,
    String contributionSeparator,
    int maxPageNumberLength,
    int maxMetadataLineLength,
    List<String> cuePhrases,
    List<String> metadataKeywords) {

  public static final List<String> DEFAULT_CUE_PHRASES =
      List.of(
          "we propose",
          "we present",
          "we introduce",
          "we develop",
          "our contribution",
          "our contributions",
          "main contribution",
          "this paper presents",
          "this paper proposes",
          "this paper introduces",
          "in this work",
          "in this paper, we");

  public static final List<String> DEFAULT_METADATA_KEYWORDS =
      List.of(
          "university",
          "department",
          "institute",
          "laboratory",
          "school of",
          "college",
          "faculty of",
          "arxiv:",
          "preprint",
          "corresponding author");

  public SegmentationConfig {
    cuePhrases = List.copyOf(cuePhrases);
    metadataKeywords = List.copyOf(metadataKeywords);
  }

  public static SegmentationConfig defaults() {
    return SegmentationConfig.builder()
        .aliasTable(HeadingAliasTable.english())
        .maxHeadingLength(60)
        .minConfidence(0.3)
        .minContentGap(1)
        .contributionScopeFraction(0.4)
        .fallbackSentenceCount(2)
        .contributionSeparator(" ")
        .maxPageNumberLength(4)
        .maxMetadataLineLength(120)
        .cuePhrases(DEFAULT_CUE_PHRASES)
        .metadataKeywords(DEFAULT_METADATA_KEYWORDS)
        .build();
  }
}
