package com.flamingo.ai.deconstructor.segmentation;

import com.flamingo.ai.deconstructor.segmentation.model.Line;
import com.flamingo.ai.deconstructor.segmentation.model.RawLine;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Cleans the raw extracted line stream:
 *
 * <ul>
 *   <li>removes zero-width characters, collapses whitespace runs and trims each line
 *   <li>drops empty lines, recording them as {@link Line#blankBefore()} on the next line
 *   <li>drops page-number artifacts (short all-digit lines isolated by blank lines or page edges)
 *   <li>joins a line ending in a hyphen with the following line when that line starts lowercase
 * </ul>
 *
 * <p>Any other line is passed through; normalization never drops content.
 */
@Slf4j
@RequiredArgsConstructor
public class LineNormalizer {

  private static final Pattern INVISIBLE_CHARS = Pattern.compile("[\\u200B\\u200C\\u200D\\uFEFF]");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern DIGITS = Pattern.compile("\\d+");

  private final SegmentationConfig config;

  /**
   * Normalizes the raw line stream.
   *
   * @param rawLines lines in reading order (null is treated as empty)
   * @return non-empty normalized lines in document order
   */
  public List<Line> normalize(List<RawLine> rawLines) {
    List<Line> lines = new ArrayList<>();
    if (rawLines == null || rawLines.isEmpty()) {
      return lines;
    }

    List<String> cleaned = rawLines.stream().map(r -> clean(r.text())).toList();
    boolean pendingBlank = false;
    int dropped = 0;
    int joined = 0;
    int i = 0;

    while (i < cleaned.size()) {
      String text = cleaned.get(i);
      if (text.isEmpty()) {
        pendingBlank = true;
        i++;
        continue;
      }
      if (isPageNumberArtifact(rawLines, cleaned, i)) {
        pendingBlank = true;
        dropped++;
        i++;
        continue;
      }

      StringBuilder merged = new StringBuilder(text);
      int next = i + 1;
      while (endsWithWordHyphen(merged)
          && next < cleaned.size()
          && startsLowercase(cleaned.get(next))) {
        merged.setLength(merged.length() - 1);
        merged.append(cleaned.get(next));
        next++;
        joined++;
      }

      lines.add(new Line(merged.toString(), rawLines.get(i).pageIndex(), pendingBlank));
      pendingBlank = false;
      i = next;
    }

    log.debug(
        "Normalized {} raw lines into {} lines ({} page numbers dropped, {} hyphenations joined)",
        rawLines.size(),
        lines.size(),
        dropped,
        joined);
    return lines;
  }

  private String clean(String text) {
    String result = INVISIBLE_CHARS.matcher(text).replaceAll("");
    return WHITESPACE.matcher(result).replaceAll(" ").strip();
  }

  private boolean isPageNumberArtifact(List<RawLine> rawLines, List<String> cleaned, int index) {
    String text = cleaned.get(index);
    if (text.length() > config.maxPageNumberLength() || !DIGITS.matcher(text).matches()) {
      return false;
    }
    int page = rawLines.get(index).pageIndex();
    boolean isolatedBefore =
        index == 0
            || cleaned.get(index - 1).isEmpty()
            || rawLines.get(index - 1).pageIndex() != page;
    boolean isolatedAfter =
        index == cleaned.size() - 1
            || cleaned.get(index + 1).isEmpty()
            || rawLines.get(index + 1).pageIndex() != page;
    return isolatedBefore && isolatedAfter;
  }

  private static boolean endsWithWordHyphen(CharSequence text) {
    int len = text.length();
    return len >= 2 && text.charAt(len - 1) == '-' && Character.isLetter(text.charAt(len - 2));
  }

  private static boolean startsLowercase(String text) {
    return !text.isEmpty() && Character.isLowerCase(text.charAt(0));
  }
}
