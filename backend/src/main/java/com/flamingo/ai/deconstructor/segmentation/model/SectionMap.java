package com.flamingo.ai.deconstructor.segmentation.model;

import com.flamingo.ai.deconstructor.exception.InvalidSectionRequestException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered mapping of canonical section to extracted span for one document.
 *
 * <p>Iteration order is the canonical report order declared by {@link CanonicalSection}, whatever
 * order the headings appeared in. Instances are immutable.
 */
public final class SectionMap {

  private final Map<CanonicalSection, SectionSpan> spans;
  private final String documentText;
  private final int lineCount;

  public SectionMap(Map<CanonicalSection, SectionSpan> spans, String documentText, int lineCount) {
    EnumMap<CanonicalSection, SectionSpan> sorted = new EnumMap<>(CanonicalSection.class);
    sorted.putAll(spans);
    this.spans = Collections.unmodifiableMap(new LinkedHashMap<>(sorted));
    this.documentText = documentText;
    this.lineCount = lineCount;
  }

  public Optional<SectionSpan> get(CanonicalSection section) {
    return Optional.ofNullable(spans.get(section));
  }

  public boolean contains(CanonicalSection section) {
    return spans.containsKey(section);
  }

  /** Present sections in canonical report order. */
  public List<CanonicalSection> names() {
    return List.copyOf(spans.keySet());
  }

  public Map<CanonicalSection, SectionSpan> asMap() {
    return spans;
  }

  /** Spans that partition the document: heading-bounded spans and the positional title. */
  public List<SectionSpan> partitionSpans() {
    return spans.values().stream().filter(s -> s.origin().isPartition()).toList();
  }

  /** The whole normalized document; backs the {@code summary} request key. */
  public String documentText() {
    return documentText;
  }

  public int lineCount() {
    return lineCount;
  }

  public boolean isEmpty() {
    return spans.isEmpty();
  }

  /**
   * Resolves request keys against this map.
   *
   * <p>{@code all} expands to every present section in canonical order; {@code summary} yields the
   * whole document and never fails; any other canonical key yields either its text or a {@link
   * SelectionStatus#SECTION_NOT_FOUND} entry. Duplicate keys are reported once, at their first
   * position.
   *
   * @param requestKeys request keys in caller order
   * @return one selection per distinct key
   * @throws InvalidSectionRequestException if no key is given or a key is unknown
   */
  public List<SectionSelection> select(Collection<String> requestKeys) {
    if (requestKeys == null || requestKeys.isEmpty()) {
      throw InvalidSectionRequestException.noSectionsRequested();
    }
    Set<String> seen = new LinkedHashSet<>();
    List<SectionSelection> selections = new ArrayList<>();
    for (String rawKey : requestKeys) {
      String key = rawKey == null ? "" : rawKey.trim().toLowerCase(Locale.ROOT);
      if (SectionSelection.ALL_KEY.equals(key)) {
        for (SectionSpan span : spans.values()) {
          if (seen.add(span.name().key())) {
            selections.add(SectionSelection.found(span));
          }
        }
      } else if (SectionSelection.SUMMARY_KEY.equals(key)) {
        if (seen.add(key)) {
          selections.add(SectionSelection.wholeDocument(documentText));
        }
      } else {
        CanonicalSection section =
            CanonicalSection.fromKey(key)
                .orElseThrow(() -> new InvalidSectionRequestException(rawKey));
        if (seen.add(section.key())) {
          SectionSpan span = spans.get(section);
          selections.add(
              span != null ? SectionSelection.found(span) : SectionSelection.notFound(section));
        }
      }
    }
    return selections;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SectionMap other)) {
      return false;
    }
    return lineCount == other.lineCount
        && spans.equals(other.spans)
        && documentText.equals(other.documentText);
  }

  @Override
  public int hashCode() {
    return spans.hashCode() * 31 + documentText.hashCode();
  }

  @Override
  public String toString() {
    return "SectionMap" + spans.keySet();
  }
}
