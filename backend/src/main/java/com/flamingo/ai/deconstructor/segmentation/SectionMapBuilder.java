package com.flamingo.ai.deconstructor.segmentation;

import com.flamingo.ai.deconstructor.segmentation.model.CanonicalSection;
import com.flamingo.ai.deconstructor.segmentation.model.Line;
import com.flamingo.ai.deconstructor.segmentation.model.SectionMap;
import com.flamingo.ai.deconstructor.segmentation.model.SectionSpan;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Assembles resolved and virtual spans into the final {@link SectionMap}.
 *
 * <p>A heading-resolved span always wins over a virtual span of the same name (possible only with
 * alias tables that give {@code title} or {@code contribution} explicit headings).
 */
public class SectionMapBuilder {

  public SectionMap build(
      List<Line> lines,
      List<SectionSpan> headingSpans,
      Optional<SectionSpan> title,
      Optional<SectionSpan> contribution) {
    Map<CanonicalSection, SectionSpan> spans = new EnumMap<>(CanonicalSection.class);
    headingSpans.forEach(span -> spans.put(span.name(), span));
    title.ifPresent(span -> spans.putIfAbsent(CanonicalSection.TITLE, span));
    contribution.ifPresent(span -> spans.putIfAbsent(CanonicalSection.CONTRIBUTION, span));
    return new SectionMap(spans, documentText(lines), lines.size());
  }

  /** Joins lines with newlines, keeping a paragraph break where the source had blank lines. */
  static String documentText(List<Line> lines) {
    StringBuilder sb = new StringBuilder();
    for (Line line : lines) {
      if (sb.length() > 0) {
        sb.append(line.blankBefore() ? "\n\n" : "\n");
      }
      sb.append(line.text());
    }
    return sb.toString();
  }
}
