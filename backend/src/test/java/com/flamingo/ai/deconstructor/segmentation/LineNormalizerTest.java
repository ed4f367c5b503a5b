package com.flamingo.ai.deconstructor.segmentation;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.deconstructor.segmentation.model.Line;
import com.flamingo.ai.deconstructor.segmentation.model.RawLine;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("LineNormalizer Tests")
class LineNormalizerTest {

  private final LineNormalizer normalizer = new LineNormalizer(SegmentationConfig.defaults());

  private static List<RawLine> page(int pageIndex, String... texts) {
    return Arrays.stream(texts).map(t -> new RawLine(t, pageIndex)).toList();
  }

  @Nested
  @DisplayName("whitespace and blank lines")
  class Whitespace {

    @Test
    @DisplayName("should collapse whitespace and strip zero-width characters")
    void shouldCollapseWhitespace_whenLineHasRunsAndInvisibleChars() {
      List<Line> lines = normalizer.normalize(page(0, "  Deep\u200B   Learning \t for X  "));

      assertThat(lines).containsExactly(new Line("Deep Learning for X", 0, false));
    }

    @Test
    @DisplayName("should record dropped empty lines as blankBefore on the next line")
    void shouldMarkBlankBefore_whenEmptyLinesPrecede() {
      List<Line> lines = normalizer.normalize(page(0, "First.", "", "   ", "Second."));

      assertThat(lines)
          .containsExactly(new Line("First.", 0, false), new Line("Second.", 0, true));
    }

    @Test
    @DisplayName("should return empty list for null or empty input")
    void shouldReturnEmpty_whenInputNullOrEmpty() {
      assertThat(normalizer.normalize(null)).isEmpty();
      assertThat(normalizer.normalize(List.of())).isEmpty();
      assertThat(normalizer.normalize(page(0, "", " \t "))).isEmpty();
    }
  }

  @Nested
  @DisplayName("page-number artifacts")
  class PageNumbers {

    @Test
    @DisplayName("should drop short number isolated by blank lines")
    void shouldDropPageNumber_whenIsolatedByBlankLines() {
      List<Line> lines = normalizer.normalize(page(0, "Text.", "", "12", "", "More text."));

      assertThat(lines).extracting(Line::text).containsExactly("Text.", "More text.");
      assertThat(lines.get(1).blankBefore()).isTrue();
    }

    @Test
    @DisplayName("should drop short number at a page edge")
    void shouldDropPageNumber_whenFollowedByPageBreak() {
      List<RawLine> raw = new ArrayList<>(page(0, "Text.", "", "3"));
      raw.addAll(page(1, "Next page."));

      List<Line> lines = normalizer.normalize(raw);

      assertThat(lines)
          .containsExactly(new Line("Text.", 0, false), new Line("Next page.", 1, true));
    }

    @Test
    @DisplayName("should keep numbers that are part of running text or too long")
    void shouldKeepNumbers_whenNotIsolatedOrTooLong() {
      List<Line> lines = normalizer.normalize(page(0, "Table 2", "42", "", "12345", ""));

      assertThat(lines).extracting(Line::text).containsExactly("Table 2", "42", "12345");
    }
  }

  @Nested
  @DisplayName("hyphenation")
  class Hyphenation {

    @Test
    @DisplayName("should join hyphenated word with a lowercase continuation")
    void shouldJoinLines_whenHyphenatedWordContinuesLowercase() {
      List<Line> lines =
          normalizer.normalize(page(0, "We learn represen-", "tations of graphs."));

      assertThat(lines)
          .extracting(Line::text)
          .containsExactly("We learn representations of graphs.");
    }

    @Test
    @DisplayName("should not join when the next line starts uppercase")
    void shouldNotJoin_whenNextLineStartsUppercase() {
      List<Line> lines = normalizer.normalize(page(0, "Self-", "Attention layers."));

      assertThat(lines).extracting(Line::text).containsExactly("Self-", "Attention layers.");
    }
  }

  @Test
  @DisplayName("should split plain text into pages on form feeds")
  void shouldAssignPageIndexes_whenTextHasFormFeeds() {
    List<RawLine> raw = RawLine.fromText("Title\r\nBody\fNext page");

    assertThat(raw)
        .containsExactly(
            new RawLine("Title", 0), new RawLine("Body", 0), new RawLine("Next page", 1));
  }
}
