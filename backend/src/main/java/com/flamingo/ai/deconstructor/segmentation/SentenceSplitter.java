package com.flamingo.ai.deconstructor.segmentation;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits running text into sentences at {@code .}, {@code !} or {@code ?} followed by whitespace
 * and an uppercase letter, digit, quote or opening bracket. Abbreviations followed by lowercase
 * text ({@code e.g. the}) do not split.
 */
final class SentenceSplitter {

  private static final Pattern BOUNDARY =
      Pattern.compile("(?<=[.!?])\\s+(?=[\\p{Lu}\\d\"“(\\[])");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private SentenceSplitter() {}

  static List<String> split(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    String flattened = WHITESPACE.matcher(text).replaceAll(" ").strip();
    return Arrays.stream(BOUNDARY.split(flattened))
        .map(String::strip)
        .filter(s -> !s.isEmpty())
        .toList();
  }
}
