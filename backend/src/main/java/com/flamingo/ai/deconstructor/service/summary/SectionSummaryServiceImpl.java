package com.flamingo.ai.deconstructor.service.summary;

import com.flamingo.ai.deconstructor.config.DeconstructorConfig;
import com.flamingo.ai.deconstructor.exception.SummarizationException;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of {@link SectionSummaryService} that summarizes chunk by chunk via an LLM. */
@Service
@RequiredArgsConstructor
@Slf4j
public class SectionSummaryServiceImpl implements SectionSummaryService {

  private final ChunkSummarizer chunkSummarizer;
  private final DeconstructorConfig deconstructorConfig;

  @Override
  @Timed(value = "section.summary", description = "Time to summarize one report section")
  public String summarize(String sectionName, String text, int minLength, int maxLength) {
    if (text == null || text.isBlank()) {
      throw new SummarizationException(
          SummarizationException.Reason.EMPTY_INPUT, "Nothing to summarize for " + sectionName);
    }
    if (minLength < 1 || maxLength < minLength) {
      throw new SummarizationException(
          SummarizationException.Reason.INVALID_LENGTH,
          "Invalid summary length bounds: min=" + minLength + ", max=" + maxLength);
    }

    List<String> chunks = chunk(text, deconstructorConfig.getSummary().getMaxChunkChars());
    log.debug(
        "Summarizing {} ({} chars) in {} chunks", sectionName, text.length(), chunks.size());

    List<String> parts = new ArrayList<>();
    for (String chunk : chunks) {
      String part = chunkSummarizer.summarizeChunk(sectionName, chunk, minLength, maxLength);
      if (!part.isBlank()) {
        parts.add(part);
      }
    }
    return String.join(" ", parts);
  }

  /** Splits text into chunks of at most {@code maxChars}, breaking on whitespace where possible. */
  static List<String> chunk(String text, int maxChars) {
    List<String> chunks = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    for (String word : text.strip().split("\\s+")) {
      if (current.length() > 0 && current.length() + 1 + word.length() > maxChars) {
        chunks.add(current.toString());
        current.setLength(0);
      }
      while (word.length() > maxChars) {
        chunks.add(word.substring(0, maxChars));
        word = word.substring(maxChars);
      }
      if (current.length() > 0) {
        current.append(' ');
      }
      current.append(word);
    }
    if (current.length() > 0) {
      chunks.add(current.toString());
    }
    return chunks;
  }
}
