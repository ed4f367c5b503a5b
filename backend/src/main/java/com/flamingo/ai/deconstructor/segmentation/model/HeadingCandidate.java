package com.flamingo.ai.deconstructor.segmentation.model;

/**
 * A line that plausibly is a section heading.
 *
 * @param lineIndex index into the normalized line sequence
 * @param canonicalName the section guessed from the heading text
 * @param confidence score in {@code [0, 1]}
 * @param matchedAlias the alias pattern that matched
 */
public record HeadingCandidate(
    int lineIndex, CanonicalSection canonicalName, double confidence, String matchedAlias) {}
