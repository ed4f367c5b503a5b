package com.flamingo.ai.deconstructor.segmentation.model;

/**
 * A normalized, non-empty document line.
 *
 * @param text trimmed text with internal whitespace collapsed
 * @param pageIndex zero-based page of the line
 * @param blankBefore whether one or more empty lines (or a dropped page-number artifact) preceded
 *     this line
 */
public record Line(String text, int pageIndex, boolean blankBefore) {}
