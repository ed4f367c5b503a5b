package com.flamingo.ai.deconstructor.segmentation.model;

import java.util.ArrayList;
import java.util.List;

/**
 * One line of text as produced by the extraction collaborator, before normalization.
 *
 * @param text the raw line text (may be blank, may carry trailing whitespace)
 * @param pageIndex zero-based page the line was extracted from
 */
public record RawLine(String text, int pageIndex) {

  public RawLine {
    text = text == null ? "" : text;
  }

  /**
   * Splits plain text into raw lines. Form-feed characters start a new page; {@code \r\n} and
   * {@code \r} are treated as line breaks.
   *
   * @param text extracted document text
   * @return lines in reading order (empty for null input)
   */
  public static List<RawLine> fromText(String text) {
    List<RawLine> lines = new ArrayList<>();
    if (text == null) {
      return lines;
    }
    String[] pages = text.replace("\r\n", "\n").replace('\r', '\n').split("\f", -1);
    for (int page = 0; page < pages.length; page++) {
      for (String line : pages[page].split("\n", -1)) {
        lines.add(new RawLine(line, page));
      }
    }
    return lines;
  }
}
