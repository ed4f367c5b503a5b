package com.flamingo.ai.deconstructor.segmentation;

import com.flamingo.ai.deconstructor.segmentation.model.AliasMatch;
import com.flamingo.ai.deconstructor.segmentation.model.CanonicalSection;
import com.flamingo.ai.deconstructor.segmentation.model.HeadingAlias;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable registry of accepted heading wordings per canonical section.
 *
 * <p>Matching is case-insensitive. A heading matches an alias exactly when the whole text equals
 * it, or by prefix when the text starts with the alias followed by a non-alphanumeric character
 * ({@code "Results and Analysis"} matches {@code results}, {@code "Methodological notes"} does not
 * match {@code method}). Exact matches win over prefix matches; among prefix matches the longest
 * alias wins.
 *
 * <p>{@link CanonicalSection#TITLE} and {@link CanonicalSection#CONTRIBUTION} have no aliases: they
 * are always inferred.
 */
public final class HeadingAliasTable {

  private static final HeadingAliasTable ENGLISH =
      HeadingAliasTable.of(
          Map.of(
              CanonicalSection.ABSTRACT,
              List.of("abstract"),
              CanonicalSection.INTRODUCTION,
              List.of("introduction", "motivation"),
              CanonicalSection.METHOD,
              List.of(
                  "method",
                  "methods",
                  "methodology",
                  "approach",
                  "our approach",
                  "proposed method",
                  "proposed approach",
                  "materials and methods",
                  "model architecture"),
              CanonicalSection.RESULTS,
              List.of(
                  "results",
                  "result",
                  "experiments",
                  "experimental results",
                  "experimental setup",
                  "experiments and results",
                  "results and discussion",
                  "evaluation"),
              CanonicalSection.CONCLUSION,
              List.of(
                  "conclusion",
                  "conclusions",
                  "discussion",
                  "concluding remarks",
                  "conclusion and future work",
                  "conclusions and future work"),
              CanonicalSection.LITERATURE_REVIEW,
              List.of(
                  "related work",
                  "related works",
                  "literature review",
                  "background",
                  "prior work",
                  "previous work"),
              CanonicalSection.REFERENCES,
              List.of("references", "bibliography", "works cited", "literature cited")));

  private final Map<CanonicalSection, HeadingAlias> aliases;

  private HeadingAliasTable(Map<CanonicalSection, HeadingAlias> aliases) {
    this.aliases = Collections.unmodifiableMap(aliases);
  }

  /** The built-in English alias set. */
  public static HeadingAliasTable english() {
    return ENGLISH;
  }

  /**
   * Builds a table from raw patterns. Patterns are lower-cased and ordered longest first; sections
   * missing from the input get no aliases, and patterns given for virtual sections are ignored.
   */
  public static HeadingAliasTable of(Map<CanonicalSection, List<String>> patterns) {
    EnumMap<CanonicalSection, HeadingAlias> table = new EnumMap<>(CanonicalSection.class);
    for (CanonicalSection section : CanonicalSection.values()) {
      List<String> raw =
          section.isVirtual() ? List.of() : patterns.getOrDefault(section, List.of());
      List<String> sectionPatterns =
          raw.stream()
              .map(p -> p.trim().toLowerCase(Locale.ROOT))
              .filter(p -> !p.isEmpty())
              .distinct()
              .sorted(Comparator.comparingInt(String::length).reversed())
              .toList();
      table.put(section, new HeadingAlias(section, sectionPatterns));
    }
    return new HeadingAliasTable(table);
  }

  public List<String> patternsFor(CanonicalSection section) {
    return aliases.get(section).patterns();
  }

  /**
   * Matches a heading text (already stripped of any enumerator) against every alias.
   *
   * @param headingText candidate heading text
   * @return the best match, or empty if no alias applies
   */
  public Optional<AliasMatch> match(String headingText) {
    if (headingText == null) {
      return Optional.empty();
    }
    String text = headingText.trim().toLowerCase(Locale.ROOT);
    while (text.endsWith(":")) {
      text = text.substring(0, text.length() - 1).trim();
    }
    if (text.isEmpty()) {
      return Optional.empty();
    }

    for (HeadingAlias alias : aliases.values()) {
      for (String pattern : alias.patterns()) {
        if (text.equals(pattern)) {
          return Optional.of(new AliasMatch(alias.canonicalName(), pattern, true));
        }
      }
    }

    AliasMatch best = null;
    for (HeadingAlias alias : aliases.values()) {
      for (String pattern : alias.patterns()) {
        if (isPrefixAtWordBoundary(text, pattern)
            && (best == null || pattern.length() > best.alias().length())) {
          best = new AliasMatch(alias.canonicalName(), pattern, false);
        }
      }
    }
    return Optional.ofNullable(best);
  }

  private static boolean isPrefixAtWordBoundary(String text, String pattern) {
    if (text.length() <= pattern.length() || !text.startsWith(pattern)) {
      return false;
    }
    return !Character.isLetterOrDigit(text.charAt(pattern.length()));
  }
}
