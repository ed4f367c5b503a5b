package com.flamingo.ai.deconstructor.config;

import com.flamingo.ai.deconstructor.agent.SectionSummaryAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for AI agents built with LangChain4j AI Services.
 *
 * <p>Pattern: define agent interfaces with @SystemMessage/@UserMessage, build concrete
 * implementations using AiServices.builder().
 */
@Configuration
public class AiAgentConfig {

  /** Section summary agent producing length-bounded plain-text summaries. */
  @Bean
  public SectionSummaryAgent sectionSummaryAgent(ChatModel chatModel) {
    return AiServices.builder(SectionSummaryAgent.class).chatModel(chatModel).build();
  }
}
