package com.flamingo.ai.deconstructor.segmentation;

import com.flamingo.ai.deconstructor.segmentation.model.CanonicalSection;
import com.flamingo.ai.deconstructor.segmentation.model.Line;
import com.flamingo.ai.deconstructor.segmentation.model.SectionSpan;
import com.flamingo.ai.deconstructor.segmentation.model.SpanOrigin;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Derives the sections that never carry a reliable heading: title and contribution. */
@Slf4j
@RequiredArgsConstructor
public class VirtualSectionExtractor {

  private static final Pattern AUTHOR_SEPARATOR = Pattern.compile("\\s*(?:,|;|&|\\band\\b)\\s*");
  // Capitalized name token or initials, optionally carrying affiliation markers (Doe1, Smith*)
  private static final Pattern NAME_TOKEN =
      Pattern.compile("(?:\\p{Lu}\\.)+|\\p{Lu}[\\p{L}'’-]*\\.?\\d*[*†‡]*");

  private final SegmentationConfig config;

  /**
   * Picks the title: the longest run of lines before the first heading, skipping author lists,
   * e-mail and affiliation lines, and all-caps running headers repeated on several pages. Runs are
   * broken by blank lines and by skipped lines; the earliest run wins a tie. Without any resolved
   * heading the first document line is the title.
   *
   * @param lines normalized document
   * @param headingSpans resolved heading spans in document order
   * @return the title span, or empty when nothing before the first heading qualifies
   */
  public Optional<SectionSpan> extractTitle(List<Line> lines, List<SectionSpan> headingSpans) {
    if (lines.isEmpty()) {
      return Optional.empty();
    }
    if (headingSpans.isEmpty()) {
      return Optional.of(positional(0, 1, lines.get(0).text()));
    }

    int firstHeading =
        headingSpans.stream().mapToInt(SectionSpan::startLine).min().orElse(lines.size());
    Set<String> runningHeaders = runningHeaders(lines);

    List<Integer> best = List.of();
    List<Integer> current = new ArrayList<>();
    for (int i = 0; i < firstHeading; i++) {
      Line line = lines.get(i);
      if (isMetadata(line.text()) || runningHeaders.contains(line.text())) {
        best = longer(best, current);
        current = new ArrayList<>();
        continue;
      }
      if (line.blankBefore() && !current.isEmpty()) {
        best = longer(best, current);
        current = new ArrayList<>();
      }
      current.add(i);
    }
    best = longer(best, current);

    if (best.isEmpty()) {
      log.debug("No title candidate before first heading at line {}", firstHeading);
      return Optional.empty();
    }
    String title =
        best.stream().map(i -> lines.get(i).text()).collect(Collectors.joining(" "));
    return Optional.of(positional(best.get(0), best.get(best.size() - 1) + 1, title));
  }

  /**
   * Collects the sentences stating the paper's contribution.
   *
   * <p>Scans the abstract and introduction (or the leading share of the document when neither was
   * found) for sentences containing a cue phrase. When none matches, the first sentences of the
   * abstract are used and the span is flagged low-confidence.
   *
   * @param lines normalized document
   * @param headingSpans resolved heading spans
   * @return the contribution span, or empty when neither cue phrases nor an abstract exist
   */
  public Optional<SectionSpan> extractContribution(
      List<Line> lines, List<SectionSpan> headingSpans) {
    if (lines.isEmpty()) {
      return Optional.empty();
    }
    Map<CanonicalSection, SectionSpan> byName = new HashMap<>();
    headingSpans.forEach(s -> byName.put(s.name(), s));

    List<SectionSpan> scope =
        Stream.of(CanonicalSection.ABSTRACT, CanonicalSection.INTRODUCTION)
            .map(byName::get)
            .filter(Objects::nonNull)
            .sorted(Comparator.comparingInt(SectionSpan::startLine))
            .toList();

    List<String> scopeTexts;
    int start;
    int end;
    if (scope.isEmpty()) {
      end = Math.max(1, (int) Math.ceil(lines.size() * config.contributionScopeFraction()));
      end = Math.min(end, lines.size());
      start = 0;
      scopeTexts = List.of(BoundaryResolver.joinLines(lines, 0, end));
    } else {
      start = scope.get(0).startLine();
      end = scope.get(scope.size() - 1).endLine();
      scopeTexts = scope.stream().map(SectionSpan::text).toList();
    }

    Set<String> matches = new LinkedHashSet<>();
    for (String text : scopeTexts) {
      for (String sentence : SentenceSplitter.split(text)) {
        if (containsCuePhrase(sentence)) {
          matches.add(sentence);
        }
      }
    }
    if (!matches.isEmpty()) {
      return Optional.of(
          new SectionSpan(
              CanonicalSection.CONTRIBUTION,
              start,
              end,
              String.join(config.contributionSeparator(), matches),
              SpanOrigin.CUE_PHRASE,
              false));
    }
    return abstractFallback(byName.get(CanonicalSection.ABSTRACT));
  }

  private Optional<SectionSpan> abstractFallback(SectionSpan abstractSpan) {
    if (abstractSpan == null) {
      log.debug("No contribution cue phrase and no abstract; contribution absent");
      return Optional.empty();
    }
    List<String> sentences =
        SentenceSplitter.split(abstractSpan.text()).stream()
            .limit(config.fallbackSentenceCount())
            .toList();
    if (sentences.isEmpty()) {
      return Optional.empty();
    }
    log.warn(
        "No contribution cue phrase found; using first {} abstract sentences", sentences.size());
    return Optional.of(
        new SectionSpan(
            CanonicalSection.CONTRIBUTION,
            abstractSpan.startLine(),
            abstractSpan.endLine(),
            String.join(config.contributionSeparator(), sentences),
            SpanOrigin.ABSTRACT_FALLBACK,
            true));
  }

  private boolean containsCuePhrase(String sentence) {
    String lower = sentence.toLowerCase(Locale.ROOT);
    return config.cuePhrases().stream().anyMatch(lower::contains);
  }

  boolean isMetadata(String text) {
    if (text.contains("@")) {
      return true;
    }
    String lower = text.toLowerCase(Locale.ROOT);
    if (config.metadataKeywords().stream().anyMatch(lower::contains)) {
      return true;
    }
    return looksLikeAuthorList(text);
  }

  // "Jane Doe, John Smith" / "A. Turing and J. von Neumann": every part is a 2-4 token name
  private boolean looksLikeAuthorList(String text) {
    if (text.length() > config.maxMetadataLineLength()) {
      return false;
    }
    if (!text.contains(",") && !text.contains("&") && !text.contains(" and ")) {
      return false;
    }
    int names = 0;
    for (String part : AUTHOR_SEPARATOR.split(text)) {
      String name = part.strip();
      if (name.isEmpty()) {
        continue;
      }
      String[] tokens = name.split("\\s+");
      if (tokens.length < 2 || tokens.length > 4) {
        return false;
      }
      for (String token : tokens) {
        if (!NAME_TOKEN.matcher(token).matches() && !isNameParticle(token)) {
          return false;
        }
      }
      names++;
    }
    return names >= 2;
  }

  private static boolean isNameParticle(String token) {
    return token.equals("van") || token.equals("von") || token.equals("de") || token.equals("der");
  }

  // Short all-caps lines repeated verbatim on two or more pages
  private Set<String> runningHeaders(List<Line> lines) {
    Map<String, Set<Integer>> pagesByText = new HashMap<>();
    for (Line line : lines) {
      if (line.text().length() <= config.maxHeadingLength() && isAllCaps(line.text())) {
        pagesByText.computeIfAbsent(line.text(), t -> new HashSet<>()).add(line.pageIndex());
      }
    }
    return pagesByText.entrySet().stream()
        .filter(e -> e.getValue().size() >= 2)
        .map(Map.Entry::getKey)
        .collect(Collectors.toSet());
  }

  private static boolean isAllCaps(String text) {
    String letters = text.replaceAll("[^\\p{L}]", "");
    return !letters.isEmpty() && letters.equals(letters.toUpperCase(Locale.ROOT));
  }

  private static List<Integer> longer(List<Integer> best, List<Integer> candidate) {
    return candidate.size() > best.size() ? candidate : best;
  }

  private static SectionSpan positional(int start, int end, String text) {
    return new SectionSpan(CanonicalSection.TITLE, start, end, text, SpanOrigin.POSITIONAL, false);
  }
}
