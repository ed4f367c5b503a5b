package com.flamingo.ai.deconstructor.service.report;

import com.flamingo.ai.deconstructor.config.DeconstructorConfig;
import com.flamingo.ai.deconstructor.segmentation.model.CanonicalSection;
import com.flamingo.ai.deconstructor.segmentation.model.RawLine;
import com.flamingo.ai.deconstructor.segmentation.model.SectionMap;
import com.flamingo.ai.deconstructor.segmentation.model.SectionSelection;
import com.flamingo.ai.deconstructor.segmentation.model.SectionSpan;
import com.flamingo.ai.deconstructor.service.parsing.PaperTextExtractorRouter;
import com.flamingo.ai.deconstructor.service.segmentation.BatchSegmentationResult;
import com.flamingo.ai.deconstructor.service.segmentation.PaperSegmentationService;
import com.flamingo.ai.deconstructor.service.summary.SectionSummaryService;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Builds paper reports: extracts the text, segments it, and fills each requested section with
 * either the extracted text or its summary.
 *
 * <p>Sections listed in {@code deconstructor.report.verbatim-sections} are copied as extracted;
 * every other found section, and the whole-document {@code summary}, goes through the {@link
 * SectionSummaryService}. Summarizer errors propagate unchanged.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaperReportService {

  private final PaperTextExtractorRouter extractorRouter;
  private final PaperSegmentationService segmentationService;
  private final SectionSummaryService summaryService;
  private final DeconstructorConfig deconstructorConfig;

  /**
   * Extracts and segments a paper.
   *
   * @param documentName document name
   * @param mimeType declared MIME type (may be null)
   * @param inputStream document content
   * @return the section map
   */
  public SectionMap segment(String documentName, String mimeType, InputStream inputStream) {
    return segmentationService.segment(documentName, extract(documentName, mimeType, inputStream));
  }

  /**
   * Extracts the raw line stream of a paper with the extractor matching its MIME type.
   *
   * @param documentName document name
   * @param mimeType declared MIME type (may be null)
   * @param inputStream document content
   * @return extracted lines in reading order
   */
  public List<RawLine> extract(String documentName, String mimeType, InputStream inputStream) {
    String resolvedMimeType = extractorRouter.resolveMimeType(mimeType, documentName);
    log.info("Processing '{}' ({})", documentName, resolvedMimeType);
    return extractorRouter.route(resolvedMimeType).extract(inputStream, documentName);
  }

  /** Segments already extracted papers concurrently, one result per document in caller order. */
  public List<BatchSegmentationResult> segmentAll(Map<String, List<RawLine>> documents) {
    return segmentationService.segmentAll(documents);
  }

  /** Extracts, segments and reports on a paper. */
  public PaperReport generate(
      String documentName, String mimeType, InputStream inputStream, ReportRequest request) {
    return buildReport(documentName, segment(documentName, mimeType, inputStream), request);
  }

  /**
   * Builds the report for an already segmented paper.
   *
   * @param documentName document name
   * @param sectionMap segmentation result
   * @param request requested sections and length bounds
   * @return the report, entries in request order
   */
  public PaperReport buildReport(
      String documentName, SectionMap sectionMap, ReportRequest request) {
    DeconstructorConfig.Summary defaults = deconstructorConfig.getSummary();
    int minLength = orDefault(request.minLength(), defaults.getMinLength());
    int maxLength = orDefault(request.maxLength(), defaults.getMaxLength());

    List<SectionSelection> selections =
        sectionMap.select(expandAll(request.sections(), sectionMap));
    log.info(
        "Generating report for '{}' with sections {}",
        documentName,
        selections.stream().map(SectionSelection::key).toList());

    List<ReportEntry> entries = new ArrayList<>();
    for (SectionSelection selection : selections) {
      entries.add(toEntry(selection, minLength, maxLength));
    }
    String title = sectionMap.get(CanonicalSection.TITLE).map(SectionSpan::text).orElse(null);
    return new PaperReport(documentName, title, entries);
  }

  private ReportEntry toEntry(SectionSelection selection, int minLength, int maxLength) {
    String heading = heading(selection);
    if (!selection.isFound()) {
      log.warn("Section '{}' not found or extracted", selection.key());
      return new ReportEntry(selection.key(), heading, selection.status(), null, false, false);
    }
    if (!selection.isWholeDocument() && isVerbatim(selection.section())) {
      return new ReportEntry(
          selection.key(),
          heading,
          selection.status(),
          selection.text(),
          false,
          selection.lowConfidence());
    }
    String summary = summaryService.summarize(heading, selection.text(), minLength, maxLength);
    return new ReportEntry(
        selection.key(), heading, selection.status(), summary, true, selection.lowConfidence());
  }

  /**
   * Replaces {@code all} with every present section plus the whole-document summary, placed right
   * after title and abstract.
   */
  static List<String> expandAll(List<String> requested, SectionMap sectionMap) {
    List<String> keys = new ArrayList<>();
    for (String key : requested) {
      if (key == null || !SectionSelection.ALL_KEY.equals(key.trim().toLowerCase(Locale.ROOT))) {
        keys.add(key);
        continue;
      }
      boolean summaryAdded = false;
      for (CanonicalSection section : sectionMap.names()) {
        if (!summaryAdded && section.ordinal() > CanonicalSection.ABSTRACT.ordinal()) {
          keys.add(SectionSelection.SUMMARY_KEY);
          summaryAdded = true;
        }
        keys.add(section.key());
      }
      if (!summaryAdded) {
        keys.add(SectionSelection.SUMMARY_KEY);
      }
    }
    return keys;
  }

  private boolean isVerbatim(CanonicalSection section) {
    return deconstructorConfig.getReport().getVerbatimSections().stream()
        .anyMatch(key -> section.key().equalsIgnoreCase(key.trim()));
  }

  private static String heading(SectionSelection selection) {
    return selection.isWholeDocument() ? "Summary" : selection.section().displayName();
  }

  private static int orDefault(Integer value, int fallback) {
    return value != null ? value : fallback;
  }
}
