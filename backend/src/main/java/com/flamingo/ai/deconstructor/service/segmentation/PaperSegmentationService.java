package com.flamingo.ai.deconstructor.service.segmentation;

import com.flamingo.ai.deconstructor.exception.SegmentationException;
import com.flamingo.ai.deconstructor.segmentation.SectionSegmentationEngine;
import com.flamingo.ai.deconstructor.segmentation.model.CanonicalSection;
import com.flamingo.ai.deconstructor.segmentation.model.RawLine;
import com.flamingo.ai.deconstructor.segmentation.model.SectionMap;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs the segmentation engine for uploaded papers and records per-section metrics.
 *
 * <p>Batches fan out one independent pipeline run per document on the {@code
 * paperProcessingExecutor}; documents share nothing but the read-only engine configuration. A
 * document the executor rejects is segmented on the calling thread.
 */
@Service
@Slf4j
public class PaperSegmentationService {

  private final SectionSegmentationEngine engine;
  private final MeterRegistry meterRegistry;
  private final Executor paperProcessingExecutor;

  public PaperSegmentationService(
      SectionSegmentationEngine engine,
      MeterRegistry meterRegistry,
      @Qualifier("paperProcessingExecutor") Executor paperProcessingExecutor) {
    this.engine = engine;
    this.meterRegistry = meterRegistry;
    this.paperProcessingExecutor = paperProcessingExecutor;
  }

  /**
   * Segments one paper.
   *
   * @param documentName document name used in logs
   * @param rawLines extracted line stream
   * @return the section map
   * @throws SegmentationException if the document holds no text
   */
  @Timed(value = "paper.segmentation", description = "Time to segment one paper")
  public SectionMap segment(String documentName, List<RawLine> rawLines) {
    SectionMap sectionMap;
    try {
      sectionMap = engine.segment(rawLines);
    } catch (SegmentationException e) {
      meterRegistry
          .counter("segmentation.documents.failed", "code", e.getErrorCode().name())
          .increment();
      log.warn("Cannot segment '{}': {} {}", documentName, e.getErrorCode(), e.getMessage());
      throw e;
    }

    for (CanonicalSection section : CanonicalSection.values()) {
      String metric =
          sectionMap.contains(section)
              ? "segmentation.sections.found"
              : "segmentation.sections.missing";
      meterRegistry.counter(metric, "section", section.key()).increment();
    }
    log.info(
        "Segmented '{}' ({} lines): found {}",
        documentName,
        sectionMap.lineCount(),
        sectionMap.names().stream().map(CanonicalSection::key).toList());
    return sectionMap;
  }

  /**
   * Segments several papers concurrently.
   *
   * @param documents document name to extracted line stream, in caller order
   * @return one result per document, in caller order
   */
  public List<BatchSegmentationResult> segmentAll(Map<String, List<RawLine>> documents) {
    Map<String, CompletableFuture<SectionMap>> futures = new LinkedHashMap<>();
    documents.forEach((name, lines) -> futures.put(name, submit(name, lines)));

    List<BatchSegmentationResult> results = new ArrayList<>();
    futures.forEach((name, future) -> results.add(await(name, future)));
    log.info(
        "Batch segmentation finished: {}/{} documents segmented",
        results.stream().filter(BatchSegmentationResult::isSuccess).count(),
        results.size());
    return results;
  }

  private CompletableFuture<SectionMap> submit(String name, List<RawLine> lines) {
    try {
      return CompletableFuture.supplyAsync(() -> segment(name, lines), paperProcessingExecutor);
    } catch (RejectedExecutionException e) {
      log.warn("Executor rejected '{}'; segmenting it on the calling thread", name);
      try {
        return CompletableFuture.completedFuture(segment(name, lines));
      } catch (SegmentationException segmentationException) {
        return CompletableFuture.failedFuture(segmentationException);
      }
    }
  }

  private BatchSegmentationResult await(String name, CompletableFuture<SectionMap> future) {
    try {
      return BatchSegmentationResult.success(name, future.join());
    } catch (CompletionException e) {
      if (e.getCause() instanceof SegmentationException segmentationException) {
        return BatchSegmentationResult.failure(name, segmentationException.getErrorCode());
      }
      throw e;
    }
  }
}
