package com.flamingo.ai.deconstructor.service.summary;

/**
 * Condenses extracted section text into a shorter plain-text summary.
 *
 * <p>Long input is summarized chunk by chunk and the chunk summaries are joined, so the result may
 * exceed {@code maxLength} words for very long sections.
 */
public interface SectionSummaryService {

  /**
   * Summarizes one section (or the whole document).
   *
   * @param sectionName display name passed to the model as context
   * @param text text to summarize
   * @param minLength lower word bound per chunk summary
   * @param maxLength upper word bound per chunk summary
   * @return the summary
   * @throws com.flamingo.ai.deconstructor.exception.SummarizationException on blank input or when
   *     {@code minLength < 1} or {@code maxLength < minLength}
   * @throws com.flamingo.ai.deconstructor.exception.LlmServiceException if the model is unavailable
   */
  String summarize(String sectionName, String text, int minLength, int maxLength);
}
