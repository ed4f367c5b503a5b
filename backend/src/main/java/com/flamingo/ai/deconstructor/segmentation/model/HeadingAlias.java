package com.flamingo.ai.deconstructor.segmentation.model;

import java.util.List;

/**
 * Accepted heading variants for one canonical section.
 *
 * @param canonicalName the section the patterns map to
 * @param patterns lower-case heading phrases, longest first
 */
public record HeadingAlias(CanonicalSection canonicalName, List<String> patterns) {

  public HeadingAlias {
    patterns = List.copyOf(patterns);
  }
}
