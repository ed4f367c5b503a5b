package com.flamingo.ai.deconstructor.segmentation;

import com.flamingo.ai.deconstructor.exception.SegmentationErrorCode;
import com.flamingo.ai.deconstructor.exception.SegmentationException;
import com.flamingo.ai.deconstructor.segmentation.model.HeadingCandidate;
import com.flamingo.ai.deconstructor.segmentation.model.Line;
import com.flamingo.ai.deconstructor.segmentation.model.RawLine;
import com.flamingo.ai.deconstructor.segmentation.model.SectionMap;
import com.flamingo.ai.deconstructor.segmentation.model.SectionSpan;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs the full segmentation pipeline for one document: normalize, detect heading candidates,
 * resolve boundaries, infer virtual sections, assemble the map.
 *
 * <p>The engine holds no per-document state; one instance can segment many documents concurrently.
 */
@Slf4j
public class SectionSegmentationEngine {

  private final LineNormalizer normalizer;
  private final HeadingCandidateDetector detector;
  private final BoundaryResolver resolver;
  private final VirtualSectionExtractor virtualExtractor;
  private final SectionMapBuilder mapBuilder;

  public SectionSegmentationEngine(SegmentationConfig config) {
    this.normalizer = new LineNormalizer(config);
    this.detector = new HeadingCandidateDetector(config);
    this.resolver = new BoundaryResolver(config);
    this.virtualExtractor = new VirtualSectionExtractor(config);
    this.mapBuilder = new SectionMapBuilder();
  }

  /**
   * Segments an extracted line stream.
   *
   * @param rawLines lines in reading order
   * @return the section map
   * @throws SegmentationException with {@link SegmentationErrorCode#EMPTY_INPUT} when no text is
   *     left after normalization
   */
  public SectionMap segment(List<RawLine> rawLines) {
    List<Line> lines = normalizer.normalize(rawLines);
    if (lines.isEmpty()) {
      throw new SegmentationException(
          SegmentationErrorCode.EMPTY_INPUT, "No text lines left after normalization");
    }

    List<HeadingCandidate> candidates = detector.detect(lines);
    List<SectionSpan> headingSpans = resolver.resolve(candidates, lines);

    // Virtual sections have no aliases, so heading spans never carry them
    Optional<SectionSpan> title = virtualExtractor.extractTitle(lines, headingSpans);
    Optional<SectionSpan> contribution =
        virtualExtractor.extractContribution(lines, headingSpans);

    SectionMap sectionMap = mapBuilder.build(lines, headingSpans, title, contribution);
    log.debug("Segmented {} lines into sections {}", lines.size(), sectionMap.names());
    return sectionMap;
  }

  /** Segments plain text; form feeds separate pages. */
  public SectionMap segment(String text) {
    return segment(RawLine.fromText(text));
  }
}
