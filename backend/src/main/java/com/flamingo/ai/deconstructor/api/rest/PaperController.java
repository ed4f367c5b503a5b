package com.flamingo.ai.deconstructor.api.rest;

import com.flamingo.ai.deconstructor.api.dto.response.BatchSegmentationResponse;
import com.flamingo.ai.deconstructor.api.dto.response.PaperReportResponse;
import com.flamingo.ai.deconstructor.api.dto.response.SectionMapResponse;
import com.flamingo.ai.deconstructor.exception.DocumentProcessingException;
import com.flamingo.ai.deconstructor.segmentation.model.RawLine;
import com.flamingo.ai.deconstructor.segmentation.model.SectionMap;
import com.flamingo.ai.deconstructor.service.report.MarkdownReportRenderer;
import com.flamingo.ai.deconstructor.service.report.PaperReport;
import com.flamingo.ai.deconstructor.service.report.PaperReportService;
import com.flamingo.ai.deconstructor.service.report.ReportRequest;
import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for paper segmentation and reports. */
@RestController
@RequestMapping("/api/papers")
@RequiredArgsConstructor
public class PaperController {

  private final PaperReportService reportService;
  private final MarkdownReportRenderer reportRenderer;

  /** Segments an uploaded paper into its canonical sections. */
  @PostMapping(value = "/sections", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<SectionMapResponse> segment(@RequestParam("file") MultipartFile file) {
    String documentName = file.getOriginalFilename();
    try (InputStream in = file.getInputStream()) {
      SectionMap sectionMap = reportService.segment(documentName, file.getContentType(), in);
      return ResponseEntity.ok(SectionMapResponse.fromSectionMap(documentName, sectionMap));
    } catch (IOException e) {
      throw new DocumentProcessingException(documentName, "Failed to read upload", e);
    }
  }

  /**
   * Segments several uploaded papers concurrently.
   *
   * <p>Results follow upload order. A document that cannot be segmented is reported with its error
   * code; one whose upload cannot be read fails the whole request. Repeated file names get a
   * {@code #n} suffix.
   */
  @PostMapping(value = "/sections/batch", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<List<BatchSegmentationResponse>> segmentBatch(
      @RequestParam("files") List<MultipartFile> files) {
    Map<String, List<RawLine>> documents = new LinkedHashMap<>();
    for (MultipartFile file : files) {
      String documentName = uniqueName(documents, file.getOriginalFilename());
      try (InputStream in = file.getInputStream()) {
        documents.put(
            documentName, reportService.extract(documentName, file.getContentType(), in));
      } catch (IOException e) {
        throw new DocumentProcessingException(documentName, "Failed to read upload", e);
      }
    }
    return ResponseEntity.ok(
        reportService.segmentAll(documents).stream()
            .map(BatchSegmentationResponse::fromResult)
            .toList());
  }

  /** Builds a report over the requested sections of an uploaded paper. */
  @PostMapping(value = "/report", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<PaperReportResponse> report(
      @RequestParam("file") MultipartFile file,
      @RequestParam("section") List<String> sections,
      @RequestParam(value = "minLength", required = false) Integer minLength,
      @RequestParam(value = "maxLength", required = false) Integer maxLength) {
    String documentName = file.getOriginalFilename();
    ReportRequest request = new ReportRequest(sections, minLength, maxLength);
    try (InputStream in = file.getInputStream()) {
      PaperReport report = reportService.generate(documentName, file.getContentType(), in, request);
      return ResponseEntity.ok(
          PaperReportResponse.fromReport(report, reportRenderer.render(report)));
    } catch (IOException e) {
      throw new DocumentProcessingException(documentName, "Failed to read upload", e);
    }
  }

  private static String uniqueName(Map<String, ?> taken, String name) {
    String base = name == null || name.isBlank() ? "document" : name;
    String candidate = base;
    for (int n = 2; taken.containsKey(candidate); n++) {
      candidate = base + "#" + n;
    }
    return candidate;
  }
}
