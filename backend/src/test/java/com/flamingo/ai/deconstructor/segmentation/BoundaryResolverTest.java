package com.flamingo.ai.deconstructor.segmentation;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.deconstructor.segmentation.model.CanonicalSection;
import com.flamingo.ai.deconstructor.segmentation.model.HeadingCandidate;
import com.flamingo.ai.deconstructor.segmentation.model.Line;
import com.flamingo.ai.deconstructor.segmentation.model.SectionSpan;
import com.flamingo.ai.deconstructor.segmentation.model.SpanOrigin;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("BoundaryResolver Tests")
class BoundaryResolverTest {

  private final BoundaryResolver resolver = new BoundaryResolver(SegmentationConfig.defaults());

  private static List<Line> lines(String... texts) {
    return Arrays.stream(texts).map(t -> new Line(t, 0, false)).toList();
  }

  private static HeadingCandidate candidate(int line, CanonicalSection section) {
    return new HeadingCandidate(line, section, 0.8, section.key());
  }

  @Test
  @DisplayName("should span each heading up to the next one, excluding the heading line")
  void shouldBuildContiguousSpans_whenCandidatesAreValid() {
    List<Line> doc = lines("Abstract", "a1", "Introduction", "i1", "i2");

    List<SectionSpan> spans =
        resolver.resolve(
            List.of(
                candidate(0, CanonicalSection.ABSTRACT),
                candidate(2, CanonicalSection.INTRODUCTION)),
            doc);

    assertThat(spans)
        .containsExactly(
            new SectionSpan(CanonicalSection.ABSTRACT, 0, 2, "a1", SpanOrigin.HEADING, false),
            new SectionSpan(
                CanonicalSection.INTRODUCTION, 2, 5, "i1\ni2", SpanOrigin.HEADING, false));
  }

  @Test
  @DisplayName("should reject table-of-contents runs without content lines")
  void shouldRejectCandidates_whenFollowedDirectlyByAnotherCandidate() {
    List<Line> doc = lines("Introduction", "Method", "Introduction", "body", "Method", "m1");

    List<SectionSpan> spans =
        resolver.resolve(
            List.of(
                candidate(0, CanonicalSection.INTRODUCTION),
                candidate(1, CanonicalSection.METHOD),
                candidate(2, CanonicalSection.INTRODUCTION),
                candidate(4, CanonicalSection.METHOD)),
            doc);

    assertThat(spans).extracting(SectionSpan::startLine).containsExactly(2, 4);
    assertThat(spans.get(0).text()).isEqualTo("body");
  }

  @Test
  @DisplayName("should keep the duplicate heading followed by the most content")
  void shouldKeepLargestSection_whenNameAppearsTwice() {
    List<Line> doc = lines("Method", "short", "Method", "m1", "m2", "m3");

    List<SectionSpan> spans =
        resolver.resolve(
            List.of(candidate(0, CanonicalSection.METHOD), candidate(2, CanonicalSection.METHOD)),
            doc);

    assertThat(spans).hasSize(1);
    assertThat(spans.get(0).startLine()).isEqualTo(2);
    assertThat(spans.get(0).text()).isEqualTo("m1\nm2\nm3");
  }

  @Test
  @DisplayName("should weigh duplicate headings by content characters, not line count")
  void shouldKeepLongerBody_whenDuplicateHasMoreButShorterLines() {
    String longBody = "widgets ".repeat(50).strip();
    List<Line> doc = lines("Introduction", "2 Method", "3 Results", "Introduction", longBody);

    List<SectionSpan> spans =
        resolver.resolve(
            List.of(
                candidate(0, CanonicalSection.INTRODUCTION),
                candidate(3, CanonicalSection.INTRODUCTION)),
            doc);

    assertThat(spans).hasSize(1);
    assertThat(spans.get(0).startLine()).isEqualTo(3);
    assertThat(spans.get(0).text()).isEqualTo(longBody);
  }

  @Test
  @DisplayName("should keep the later heading on a content tie")
  void shouldKeepLaterHeading_whenContentTies() {
    List<Line> doc = lines("Results", "r1", "Results", "r2");

    List<SectionSpan> spans =
        resolver.resolve(
            List.of(
                candidate(0, CanonicalSection.RESULTS), candidate(2, CanonicalSection.RESULTS)),
            doc);

    assertThat(spans).extracting(SectionSpan::startLine).containsExactly(2);
  }

  @Test
  @DisplayName("should drop an empty span and extend the previous one over its line")
  void shouldDropEmptySpan_whenMinContentGapIsZero() {
    BoundaryResolver lenient =
        new BoundaryResolver(SegmentationConfig.defaults().toBuilder().minContentGap(0).build());
    List<Line> doc = lines("Method", "m1", "Results", "Conclusion", "c1");

    List<SectionSpan> spans =
        lenient.resolve(
            List.of(
                candidate(0, CanonicalSection.METHOD),
                candidate(2, CanonicalSection.RESULTS),
                candidate(3, CanonicalSection.CONCLUSION)),
            doc);

    assertThat(spans)
        .extracting(SectionSpan::name)
        .containsExactly(CanonicalSection.METHOD, CanonicalSection.CONCLUSION);
    assertThat(spans.get(0).endLine()).isEqualTo(3);
    assertThat(spans.get(0).text()).isEqualTo("m1\nResults");
  }

  @Test
  @DisplayName("should return no spans when no candidate survives")
  void shouldReturnEmpty_whenNoCandidates() {
    assertThat(resolver.resolve(List.of(), lines("Just text."))).isEmpty();
  }
}
