package com.flamingo.ai.deconstructor.api.rest;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.deconstructor.exception.ApiError;
import com.flamingo.ai.deconstructor.exception.SegmentationErrorCode;
import com.flamingo.ai.deconstructor.exception.GlobalExceptionHandler;
import com.flamingo.ai.deconstructor.exception.InvalidSectionRequestException;
import com.flamingo.ai.deconstructor.segmentation.SamplePapers;
import com.flamingo.ai.deconstructor.segmentation.SectionSegmentationEngine;
import com.flamingo.ai.deconstructor.segmentation.SegmentationConfig;
import com.flamingo.ai.deconstructor.segmentation.model.RawLine;
import com.flamingo.ai.deconstructor.segmentation.model.SectionMap;
import com.flamingo.ai.deconstructor.segmentation.model.SelectionStatus;
import com.flamingo.ai.deconstructor.service.report.MarkdownReportRenderer;
import com.flamingo.ai.deconstructor.service.report.PaperReport;
import com.flamingo.ai.deconstructor.service.report.PaperReportService;
import com.flamingo.ai.deconstructor.service.report.ReportEntry;
import com.flamingo.ai.deconstructor.service.report.ReportRequest;
import com.flamingo.ai.deconstructor.service.segmentation.BatchSegmentationResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("PaperController Tests")
class PaperControllerTest {

  private static final SectionMap PAPER =
      new SectionSegmentationEngine(SegmentationConfig.defaults())
          .segment(SamplePapers.WELL_FORMED);

  @Mock private PaperReportService reportService;
  @Mock private MarkdownReportRenderer reportRenderer;

  private MockMvc mockMvc;
  private MockMultipartFile file;

  @BeforeEach
  void setUp() {
    PaperController controller = new PaperController(reportService, reportRenderer);
    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
    file =
        new MockMultipartFile(
            "file",
            "paper.txt",
            "text/plain",
            SamplePapers.WELL_FORMED.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  @DisplayName("should return the section map in canonical order")
  void shouldReturnSections_whenPaperUploaded() throws Exception {
    when(reportService.segment(eq("paper.txt"), eq("text/plain"), any(InputStream.class)))
        .thenReturn(PAPER);

    mockMvc
        .perform(multipart("/api/papers/sections").file(file))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.documentName").value("paper.txt"))
        .andExpect(jsonPath("$.lineCount").value(17))
        .andExpect(jsonPath("$.sections[0].key").value("title"))
        .andExpect(jsonPath("$.sections[0].text").value("Deep Learning for X"))
        .andExpect(jsonPath("$.sections[1].key").value("abstract"))
        .andExpect(jsonPath("$.sections[1].origin").value("HEADING"));
  }

  @Test
  @DisplayName("should return report entries and rendered markdown")
  void shouldReturnReport_whenSectionsRequested() throws Exception {
    PaperReport report =
        new PaperReport(
            "paper.txt",
            "Deep Learning for X",
            List.of(
                new ReportEntry(
                    "title", "Title", SelectionStatus.FOUND, "Deep Learning for X", false, false),
                new ReportEntry(
                    "literature_review",
                    "Literature review",
                    SelectionStatus.SECTION_NOT_FOUND,
                    null,
                    false,
                    false)));
    when(reportService.generate(
            eq("paper.txt"),
            eq("text/plain"),
            any(InputStream.class),
            eq(new ReportRequest(List.of("title", "literature_review"), 20, null))))
        .thenReturn(report);
    when(reportRenderer.render(report)).thenReturn("# Analysis of Deep Learning for X\n");

    mockMvc
        .perform(
            multipart("/api/papers/report")
                .file(file)
                .param("section", "title", "literature_review")
                .param("minLength", "20"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.title").value("Deep Learning for X"))
        .andExpect(jsonPath("$.entries[0].key").value("title"))
        .andExpect(jsonPath("$.entries[1].status").value("SECTION_NOT_FOUND"))
        .andExpect(jsonPath("$.markdown").value("# Analysis of Deep Learning for X\n"));
  }

  @Test
  @DisplayName("should answer 400 for an unknown section")
  void shouldReturnBadRequest_whenSectionUnknown() throws Exception {
    when(reportService.generate(any(), any(), any(), any()))
        .thenThrow(new InvalidSectionRequestException("appendix"));

    mockMvc
        .perform(multipart("/api/papers/report").file(file).param("section", "appendix"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value(ApiError.SECTION_UNKNOWN))
        .andExpect(jsonPath("$.message").value("Unknown section: appendix"));
  }

  @Test
  @DisplayName("should answer 400 when the file part is missing")
  void shouldReturnBadRequest_whenFileMissing() throws Exception {
    mockMvc
        .perform(multipart("/api/papers/sections"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value(ApiError.VALIDATION_ERROR));
    verifyNoInteractions(reportService);
  }

  @Test
  @DisplayName("should segment every uploaded file and report failures per document")
  void shouldReturnBatchResults_whenSeveralFilesUploaded() throws Exception {
    List<RawLine> paperLines = RawLine.fromText(SamplePapers.WELL_FORMED);
    when(reportService.extract(eq("paper.txt"), eq("text/plain"), any(InputStream.class)))
        .thenReturn(paperLines);
    when(reportService.extract(eq("paper.txt#2"), eq("text/plain"), any(InputStream.class)))
        .thenReturn(List.of());
    Map<String, List<RawLine>> expected = new LinkedHashMap<>();
    expected.put("paper.txt", paperLines);
    expected.put("paper.txt#2", List.of());
    when(reportService.segmentAll(expected))
        .thenReturn(
            List.of(
                BatchSegmentationResult.success("paper.txt", PAPER),
                BatchSegmentationResult.failure(
                    "paper.txt#2", SegmentationErrorCode.EMPTY_INPUT)));
    MockMultipartFile blank =
        new MockMultipartFile("files", "paper.txt", "text/plain", new byte[0]);

    mockMvc
        .perform(
            multipart("/api/papers/sections/batch")
                .file(
                    new MockMultipartFile(
                        "files", "paper.txt", "text/plain", file.getBytes()))
                .file(blank))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].documentName").value("paper.txt"))
        .andExpect(jsonPath("$[0].success").value(true))
        .andExpect(jsonPath("$[0].sectionMap.sections[0].key").value("title"))
        .andExpect(jsonPath("$[1].documentName").value("paper.txt#2"))
        .andExpect(jsonPath("$[1].success").value(false))
        .andExpect(jsonPath("$[1].errorCode").value("EMPTY_INPUT"));
  }
}
