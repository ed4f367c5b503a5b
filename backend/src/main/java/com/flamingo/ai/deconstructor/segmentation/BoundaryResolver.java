package com.flamingo.ai.deconstructor.segmentation;

import com.flamingo.ai.deconstructor.exception.SegmentationErrorCode;
import com.flamingo.ai.deconstructor.segmentation.model.CanonicalSection;
import com.flamingo.ai.deconstructor.segmentation.model.HeadingCandidate;
import com.flamingo.ai.deconstructor.segmentation.model.Line;
import com.flamingo.ai.deconstructor.segmentation.model.SectionSpan;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns heading candidates into name-unique, non-overlapping section spans.
 *
 * <p>The content of a candidate is every line after it up to the next candidate of any name.
 * Candidates with fewer than {@link SegmentationConfig#minContentGap()} content lines are
 * rejected: they are the runs of consecutive pseudo-headings a table of contents produces. Among
 * the remaining candidates of one section the one followed by the most content characters wins,
 * the later line on a tie. A table of contents entry followed by a few short entry lines thus
 * loses to a real heading whose body is a single long line.
 *
 * <p>Survivors are ordered by position and each span runs from its heading line (excluded from the
 * text) up to the next survivor's heading line or the end of the document.
 *
 * <p>A survivor whose span would carry no text is dropped as a false positive; its line falls to
 * the preceding span. Sections without survivors are simply absent.
 */
@Slf4j
@RequiredArgsConstructor
public class BoundaryResolver {

  private record ScoredCandidate(HeadingCandidate candidate, int contentChars) {

    int lineIndex() {
      return candidate.lineIndex();
    }
  }

  private static final Comparator<ScoredCandidate> BEST_FIRST =
      Comparator.comparingInt(ScoredCandidate::contentChars)
          .thenComparingInt(ScoredCandidate::lineIndex)
          .reversed();

  private final SegmentationConfig config;

  /**
   * Resolves candidates into spans.
   *
   * @param candidates heading candidates in document order
   * @param lines the normalized document
   * @return heading spans ordered by document position
   */
  public List<SectionSpan> resolve(List<HeadingCandidate> candidates, List<Line> lines) {
    List<ScoredCandidate> valid = score(candidates, lines);

    Map<CanonicalSection, List<ScoredCandidate>> groups =
        valid.stream()
            .collect(
                Collectors.groupingBy(
                    s -> s.candidate().canonicalName(),
                    () -> new EnumMap<>(CanonicalSection.class),
                    Collectors.toList()));

    List<HeadingCandidate> survivors = new ArrayList<>();
    for (Map.Entry<CanonicalSection, List<ScoredCandidate>> group : groups.entrySet()) {
      survivors.add(selectBest(group.getKey(), group.getValue(), lines));
    }
    survivors.sort(Comparator.comparingInt(HeadingCandidate::lineIndex));

    List<SectionSpan> spans = buildSpans(survivors, lines);
    log.debug(
        "Resolved {} candidates into {} spans: {}",
        candidates.size(),
        spans.size(),
        spans.stream().map(s -> s.name().key()).toList());
    return spans;
  }

  private List<ScoredCandidate> score(List<HeadingCandidate> candidates, List<Line> lines) {
    List<ScoredCandidate> valid = new ArrayList<>();
    for (int k = 0; k < candidates.size(); k++) {
      HeadingCandidate candidate = candidates.get(k);
      int nextLine = k + 1 < candidates.size() ? candidates.get(k + 1).lineIndex() : lines.size();
      int contentLines = nextLine - candidate.lineIndex() - 1;
      if (contentLines < config.minContentGap()) {
        log.debug(
            "Rejecting heading candidate at line {} ({}): only {} content lines follow",
            candidate.lineIndex(),
            candidate.canonicalName().key(),
            contentLines);
        continue;
      }
      int contentChars = 0;
      for (int i = candidate.lineIndex() + 1; i < nextLine; i++) {
        contentChars += lines.get(i).text().length();
      }
      valid.add(new ScoredCandidate(candidate, contentChars));
    }
    return valid;
  }

  private HeadingCandidate selectBest(
      CanonicalSection section, List<ScoredCandidate> group, List<Line> lines) {
    ScoredCandidate best = group.stream().sorted(BEST_FIRST).findFirst().orElseThrow();
    if (group.size() > 1) {
      log.warn(
          "{}: {} headings compete for '{}' at lines {}; keeping line {} ('{}')",
          SegmentationErrorCode.AMBIGUOUS_HEADING,
          group.size(),
          section.key(),
          group.stream().map(ScoredCandidate::lineIndex).toList(),
          best.lineIndex(),
          lines.get(best.lineIndex()).text());
    }
    return best.candidate();
  }

  private List<SectionSpan> buildSpans(List<HeadingCandidate> survivors, List<Line> lines) {
    List<HeadingCandidate> kept = new ArrayList<>(survivors);
    List<SectionSpan> spans = new ArrayList<>();
    int k = 0;
    while (k < kept.size()) {
      HeadingCandidate current = kept.get(k);
      int end = k + 1 < kept.size() ? kept.get(k + 1).lineIndex() : lines.size();
      String text = joinLines(lines, current.lineIndex() + 1, end);
      if (text.isBlank()) {
        log.debug(
            "Dropping empty '{}' heading at line {}",
            current.canonicalName().key(),
            current.lineIndex());
        kept.remove(k);
        if (k > 0) {
          // The previous span now extends over the dropped heading line
          spans.remove(spans.size() - 1);
          k--;
        }
        continue;
      }
      spans.add(SectionSpan.heading(current.canonicalName(), current.lineIndex(), end, text));
      k++;
    }
    return spans;
  }

  static String joinLines(List<Line> lines, int from, int to) {
    StringBuilder sb = new StringBuilder();
    for (int i = from; i < to; i++) {
      if (sb.length() > 0) {
        sb.append('\n');
      }
      sb.append(lines.get(i).text());
    }
    return sb.toString();
  }
}
