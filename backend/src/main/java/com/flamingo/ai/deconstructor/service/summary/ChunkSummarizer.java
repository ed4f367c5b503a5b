package com.flamingo.ai.deconstructor.service.summary;

import com.flamingo.ai.deconstructor.agent.SectionSummaryAgent;
import com.flamingo.ai.deconstructor.exception.LlmServiceException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Calls the summary agent for a single chunk, guarded by retry and circuit breaker. */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChunkSummarizer {

  private final SectionSummaryAgent sectionSummaryAgent;
  private final MeterRegistry meterRegistry;

  @CircuitBreaker(name = "openai", fallbackMethod = "summarizeChunkFallback")
  @Retry(name = "openai")
  public String summarizeChunk(String sectionName, String chunk, int minLength, int maxLength) {
    log.debug("Summarizing {} chunk of {} chars", sectionName, chunk.length());
    String summary = sectionSummaryAgent.summarize(sectionName, chunk, minLength, maxLength);
    meterRegistry.counter("summary.chunks.success").increment();
    return summary == null ? "" : summary.strip();
  }

  @SuppressWarnings("unused")
  private String summarizeChunkFallback(
      String sectionName, String chunk, int minLength, int maxLength, Throwable t) {
    log.error("Summary agent failed for {}: {}", sectionName, t.getMessage());
    meterRegistry.counter("summary.chunks.failure").increment();
    throw new LlmServiceException("Failed to summarize " + sectionName, t);
  }
}
