package com.flamingo.ai.deconstructor.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that condenses one chunk of a research-paper section into a plain-text summary within
 * caller-supplied word bounds.
 */
public interface SectionSummaryAgent {

  @SystemMessage(
      """
        You are a research-paper summarization expert. Summarize the provided excerpt of a
        paper section in plain prose. Keep technical terms, datasets and reported numbers.
        Do not use markdown headers or bullet points. Do not start with "This section" or
        "The excerpt". Do not add information that is not in the excerpt.
        """)
  @UserMessage(
      """
        Section: {{section}}

        Write a summary between {{minLength}} and {{maxLength}} words of the following excerpt:
        {{content}}
        """)
  String summarize(
      @V("section") String section,
      @V("content") String content,
      @V("minLength") int minLength,
      @V("maxLength") int maxLength);
}
