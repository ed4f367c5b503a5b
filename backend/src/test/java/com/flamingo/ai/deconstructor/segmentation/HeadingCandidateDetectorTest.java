package com.flamingo.ai.deconstructor.segmentation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.deconstructor.segmentation.model.AliasMatch;
import com.flamingo.ai.deconstructor.segmentation.model.CanonicalSection;
import com.flamingo.ai.deconstructor.segmentation.model.HeadingCandidate;
import com.flamingo.ai.deconstructor.segmentation.model.Line;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("HeadingCandidateDetector Tests")
class HeadingCandidateDetectorTest {

  private final HeadingCandidateDetector detector =
      new HeadingCandidateDetector(SegmentationConfig.defaults());

  private List<HeadingCandidate> detectAfterParagraph(String heading) {
    return detector.detect(
        List.of(new Line("Some paragraph text.", 0, false), new Line(heading, 0, true)));
  }

  @Nested
  @DisplayName("candidate conditions")
  class Conditions {

    @Test
    @DisplayName("should flag enumerated heading after a blank line")
    void shouldDetectHeading_whenEnumeratedAfterBlankLine() {
      List<HeadingCandidate> candidates = detectAfterParagraph("1. Introduction");

      assertThat(candidates).hasSize(1);
      HeadingCandidate candidate = candidates.get(0);
      assertThat(candidate.lineIndex()).isEqualTo(1);
      assertThat(candidate.canonicalName()).isEqualTo(CanonicalSection.INTRODUCTION);
      assertThat(candidate.matchedAlias()).isEqualTo("introduction");
      assertThat(candidate.confidence()).isCloseTo(0.9, within(1e-9));
    }

    @Test
    @DisplayName("should strip Roman and dotted enumerators")
    void shouldDetectHeading_whenRomanOrDottedEnumerator() {
      assertThat(detectAfterParagraph("IV. RESULTS"))
          .extracting(HeadingCandidate::canonicalName)
          .containsExactly(CanonicalSection.RESULTS);
      assertThat(detectAfterParagraph("2.1 Related Work"))
          .extracting(HeadingCandidate::canonicalName)
          .containsExactly(CanonicalSection.LITERATURE_REVIEW);
    }

    @Test
    @DisplayName("should ignore heading text inside a paragraph")
    void shouldIgnoreLine_whenNoBlankLineAndSamePage() {
      List<HeadingCandidate> candidates =
          detector.detect(
              List.of(new Line("Some paragraph text.", 0, false), new Line("Method", 0, false)));

      assertThat(candidates).isEmpty();
    }

    @Test
    @DisplayName("should accept heading that opens a page")
    void shouldDetectHeading_whenLineOpensPage() {
      List<HeadingCandidate> candidates =
          detector.detect(
              List.of(new Line("Some paragraph text.", 0, false), new Line("Method", 1, false)));

      assertThat(candidates)
          .extracting(HeadingCandidate::canonicalName)
          .containsExactly(CanonicalSection.METHOD);
    }

    @Test
    @DisplayName("should reject lines ending in sentence punctuation")
    void shouldIgnoreLine_whenEndsWithPeriodCommaOrSemicolon() {
      assertThat(detectAfterParagraph("Results.")).isEmpty();
      assertThat(detectAfterParagraph("Results,")).isEmpty();
      assertThat(detectAfterParagraph("Results;")).isEmpty();
    }

    @Test
    @DisplayName("should reject lines longer than the heading limit")
    void shouldIgnoreLine_whenTooLong() {
      String longLine = "Results " + "x".repeat(60);

      assertThat(detectAfterParagraph(longLine)).isEmpty();
    }

    @Test
    @DisplayName("should reject lines without a matching alias")
    void shouldIgnoreLine_whenNoAliasMatches() {
      assertThat(detectAfterParagraph("Acknowledgements")).isEmpty();
    }
  }

  @Nested
  @DisplayName("confidence")
  class Confidence {

    @Test
    @DisplayName("should score exact all-caps enumerated heading at the cap")
    void shouldCapConfidence_whenAllSignalsPresent() {
      double score =
          HeadingCandidateDetector.confidence(
              new AliasMatch(CanonicalSection.METHOD, "method", true), "METHOD", true);

      assertThat(score).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should score lowercase prefix match lowest")
    void shouldScoreLowest_whenLowercasePrefixMatch() {
      double score =
          HeadingCandidateDetector.confidence(
              new AliasMatch(CanonicalSection.RESULTS, "results", false),
              "results and more",
              false);

      assertThat(score).isCloseTo(HeadingCandidateDetector.PREFIX_MATCH_WEIGHT, within(1e-9));
    }

    @Test
    @DisplayName("should rank all caps over title case over sentence case")
    void shouldRankFormatting_whenSameAlias() {
      AliasMatch match = new AliasMatch(CanonicalSection.LITERATURE_REVIEW, "related work", true);

      double allCaps = HeadingCandidateDetector.confidence(match, "RELATED WORK", false);
      double titleCase = HeadingCandidateDetector.confidence(match, "Related Work", false);
      double sentenceCase = HeadingCandidateDetector.confidence(match, "Related work", false);
      double lowerCase = HeadingCandidateDetector.confidence(match, "related work", false);

      assertThat(allCaps).isGreaterThan(titleCase);
      assertThat(titleCase).isGreaterThan(sentenceCase);
      assertThat(sentenceCase).isGreaterThan(lowerCase);
    }

    @Test
    @DisplayName("should drop candidates below the minimum confidence")
    void shouldDropCandidate_whenBelowMinConfidence() {
      HeadingCandidateDetector strict =
          new HeadingCandidateDetector(
              SegmentationConfig.defaults().toBuilder().minConfidence(0.5).build());

      List<HeadingCandidate> candidates =
          strict.detect(
              List.of(
                  new Line("Intro text.", 0, false),
                  new Line("results and more", 0, true),
                  new Line("More text.", 0, false),
                  new Line("Results", 0, true)));

      assertThat(candidates).extracting(HeadingCandidate::lineIndex).containsExactly(3);
    }
  }
}
