package com.flamingo.ai.deconstructor.cli;

import com.flamingo.ai.deconstructor.config.DeconstructorConfig;
import com.flamingo.ai.deconstructor.exception.DocumentProcessingException;
import com.flamingo.ai.deconstructor.exception.InvalidSectionRequestException;
import com.flamingo.ai.deconstructor.exception.LlmServiceException;
import com.flamingo.ai.deconstructor.exception.SegmentationException;
import com.flamingo.ai.deconstructor.exception.SummarizationException;
import com.flamingo.ai.deconstructor.service.report.MarkdownReportRenderer;
import com.flamingo.ai.deconstructor.service.report.PaperReport;
import com.flamingo.ai.deconstructor.service.report.PaperReportService;
import com.flamingo.ai.deconstructor.service.report.ReportRequest;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Generates a Markdown report from the command line.
 *
 * <p>Runs only when {@code --input} is given:
 *
 * <pre>
 * --input=paper.pdf --output=report.md --section=title --section=summary
 *     [--min-length=40] [--max-length=150]
 * </pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PaperReportCommandLineRunner implements ApplicationRunner {

  static final String USAGE =
      "Usage: --input=<paper> --output=<report.md> --section=<name> [--section=<name> ...]"
          + " [--min-length=<words>] [--max-length=<words>]";

  private final PaperReportService reportService;
  private final MarkdownReportRenderer reportRenderer;
  private final DeconstructorConfig deconstructorConfig;

  @Override
  public void run(ApplicationArguments args) {
    if (!args.containsOption("input")) {
      return;
    }
    String input = singleValue(args, "input");
    String output = singleValue(args, "output");
    List<String> sections = args.getOptionValues("section");
    if (input == null || output == null || sections == null || sections.isEmpty()) {
      log.error(USAGE);
      return;
    }

    Integer minLength;
    Integer maxLength;
    try {
      minLength = intValue(args, "min-length", deconstructorConfig.getSummary().getMinLength());
      maxLength = intValue(args, "max-length", deconstructorConfig.getSummary().getMaxLength());
    } catch (NumberFormatException e) {
      log.error("Invalid length option: {}. {}", e.getMessage(), USAGE);
      return;
    }

    Path inputPath = Path.of(input);
    Path outputPath = Path.of(output);
    String documentName = inputPath.getFileName().toString();
    log.info("Processing {}...", inputPath);
    try (InputStream in = Files.newInputStream(inputPath)) {
      PaperReport report =
          reportService.generate(
              documentName, null, in, new ReportRequest(sections, minLength, maxLength));
      Files.writeString(outputPath, reportRenderer.render(report), StandardCharsets.UTF_8);
      log.info("Saved report to {}", outputPath);
    } catch (IOException e) {
      log.error("I/O failure reading {} or writing {}: {}", inputPath, outputPath, e.getMessage());
    } catch (DocumentProcessingException
        | SegmentationException
        | InvalidSectionRequestException
        | SummarizationException
        | LlmServiceException e) {
      log.error("Report generation failed for {}: {}", inputPath, e.getMessage());
    }
  }

  private static String singleValue(ApplicationArguments args, String name) {
    List<String> values = args.getOptionValues(name);
    return values == null || values.isEmpty() ? null : values.get(values.size() - 1);
  }

  private static Integer intValue(ApplicationArguments args, String name, int fallback) {
    String value = singleValue(args, name);
    return value == null ? fallback : Integer.valueOf(value.trim());
  }
}
