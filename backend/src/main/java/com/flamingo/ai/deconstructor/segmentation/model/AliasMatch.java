package com.flamingo.ai.deconstructor.segmentation.model;

/**
 * Result of matching a heading text against the alias table.
 *
 * @param canonicalName matched section
 * @param alias the alias pattern that matched
 * @param exact {@code true} when the whole text equals the alias, {@code false} for a prefix match
 */
public record AliasMatch(CanonicalSection canonicalName, String alias, boolean exact) {}
