package com.flamingo.ai.deconstructor.segmentation;

import com.flamingo.ai.deconstructor.segmentation.model.AliasMatch;
import com.flamingo.ai.deconstructor.segmentation.model.HeadingCandidate;
import com.flamingo.ai.deconstructor.segmentation.model.Line;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Flags normalized lines that plausibly are section headings.
 *
 * <p>A line becomes a candidate only when all of the following hold:
 *
 * <ol>
 *   <li>it is no longer than {@link SegmentationConfig#maxHeadingLength()}
 *   <li>it follows a blank line or opens a page
 *   <li>after stripping a leading enumerator ({@code 1.}, {@code 1.2}, {@code IV.}) it equals or
 *       starts with an alias from the {@link HeadingAliasTable}
 *   <li>it does not end with {@code .}, {@code ,} or {@code ;}
 * </ol>
 *
 * <p>Confidence rewards exact alias matches over prefix matches and strong formatting (all caps,
 * then title case, then sentence case); an enumerator adds a small bonus. Candidates are returned
 * in document order without deduplication.
 */
@Slf4j
@RequiredArgsConstructor
public class HeadingCandidateDetector {

  static final double EXACT_MATCH_WEIGHT = 0.6;
  static final double PREFIX_MATCH_WEIGHT = 0.3;
  static final double ALL_CAPS_BONUS = 0.3;
  static final double TITLE_CASE_BONUS = 0.2;
  static final double SENTENCE_CASE_BONUS = 0.1;
  static final double ENUMERATOR_BONUS = 0.1;

  // Arabic section numbers (1, 1.2, 3.1.4) or Roman numerals up to XXXIX
  private static final Pattern ENUMERATOR =
      Pattern.compile(
          "^(?:\\d{1,2}(?:\\.\\d{1,2})*|(?=[IVX])X{0,3}(?:IX|IV|V?I{0,3}))(?:[.):]\\s*|\\s+)");

  private final SegmentationConfig config;

  /**
   * Scans the normalized lines for heading candidates.
   *
   * @param lines normalized document lines
   * @return candidates in document order
   */
  public List<HeadingCandidate> detect(List<Line> lines) {
    List<HeadingCandidate> candidates = new ArrayList<>();
    for (int i = 0; i < lines.size(); i++) {
      detectAt(lines, i).ifPresent(candidates::add);
    }
    log.debug("Detected {} heading candidates in {} lines", candidates.size(), lines.size());
    return candidates;
  }

  private Optional<HeadingCandidate> detectAt(List<Line> lines, int index) {
    Line line = lines.get(index);
    String text = line.text();

    if (text.length() > config.maxHeadingLength()) {
      return Optional.empty();
    }
    if (!line.blankBefore() && !opensPage(lines, index)) {
      return Optional.empty();
    }
    if (endsWithTerminalPunctuation(text)) {
      return Optional.empty();
    }

    Matcher enumerator = ENUMERATOR.matcher(text);
    boolean enumerated = enumerator.find();
    String body = enumerated ? text.substring(enumerator.end()) : text;

    Optional<AliasMatch> match = config.aliasTable().match(body);
    if (match.isEmpty()) {
      return Optional.empty();
    }

    double confidence = confidence(match.get(), body, enumerated);
    if (confidence < config.minConfidence()) {
      log.debug("Discarding weak heading candidate '{}' (confidence {})", text, confidence);
      return Optional.empty();
    }
    return Optional.of(
        new HeadingCandidate(
            index, match.get().canonicalName(), confidence, match.get().alias()));
  }

  static double confidence(AliasMatch match, String body, boolean enumerated) {
    double score = match.exact() ? EXACT_MATCH_WEIGHT : PREFIX_MATCH_WEIGHT;
    score += formattingBonus(body);
    if (enumerated) {
      score += ENUMERATOR_BONUS;
    }
    return Math.min(1.0, score);
  }

  private static double formattingBonus(String body) {
    String letters = body.replaceAll("[^\\p{L}]", "");
    if (letters.isEmpty()) {
      return 0.0;
    }
    if (letters.length() > 1 && letters.equals(letters.toUpperCase(Locale.ROOT))) {
      return ALL_CAPS_BONUS;
    }
    if (isTitleCase(body)) {
      return TITLE_CASE_BONUS;
    }
    return Character.isUpperCase(letters.charAt(0)) ? SENTENCE_CASE_BONUS : 0.0;
  }

  // Every word longer than three letters is capitalized; short function words may stay lowercase
  private static boolean isTitleCase(String body) {
    String[] words = body.trim().split("[\\s,:;-]+");
    if (words.length == 0 || words[0].isEmpty() || !Character.isUpperCase(words[0].charAt(0))) {
      return false;
    }
    for (String word : words) {
      if (word.length() > 3 && !Character.isUpperCase(word.charAt(0))) {
        return false;
      }
    }
    return true;
  }

  private static boolean opensPage(List<Line> lines, int index) {
    return index == 0 || lines.get(index - 1).pageIndex() != lines.get(index).pageIndex();
  }

  private static boolean endsWithTerminalPunctuation(String text) {
    char last = text.charAt(text.length() - 1);
    return last == '.' || last == ',' || last == ';';
  }
}
