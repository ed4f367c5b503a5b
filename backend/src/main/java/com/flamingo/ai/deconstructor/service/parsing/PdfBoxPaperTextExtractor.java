package com.flamingo.ai.deconstructor.service.parsing;

import com.flamingo.ai.deconstructor.exception.DocumentProcessingException;
import com.flamingo.ai.deconstructor.segmentation.model.RawLine;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * {@link PaperTextExtractor} for PDF documents.
 *
 * <p>Uses Apache PDFBox 3.x to strip text one page at a time, sorted by position, so every line
 * keeps its page index. PDFBox's paragraph breaks are written as empty lines, so a heading set
 * off by vertical space reaches the segmentation engine with a blank line before it.
 */
@Service
@Order(10)
@Slf4j
public class PdfBoxPaperTextExtractor implements PaperTextExtractor {

  @Override
  public List<RawLine> extract(InputStream inputStream, String documentName) {
    try {
      byte[] bytes = inputStream.readAllBytes();
      try (PDDocument pdfDoc = Loader.loadPDF(bytes)) {
        return extractLines(pdfDoc, documentName);
      }
    } catch (IOException e) {
      log.error("PDFBox extraction failed for '{}': {}", documentName, e.getMessage());
      throw new DocumentProcessingException(
          documentName, "Failed to parse PDF: " + e.getMessage(), e);
    }
  }

  @Override
  public boolean supports(String mimeType) {
    return "application/pdf".equalsIgnoreCase(mimeType);
  }

  private List<RawLine> extractLines(PDDocument pdfDoc, String documentName) throws IOException {
    PDFTextStripper stripper = new PDFTextStripper();
    stripper.setSortByPosition(true);
    stripper.setLineSeparator("\n");
    stripper.setParagraphEnd("\n");

    int pageCount = pdfDoc.getNumberOfPages();
    List<RawLine> lines = new ArrayList<>();
    for (int page = 1; page <= pageCount; page++) {
      stripper.setStartPage(page);
      stripper.setEndPage(page);
      String pageText = stripper.getText(pdfDoc);
      for (String line : pageText.split("\n", -1)) {
        lines.add(new RawLine(line, page - 1));
      }
    }
    log.debug(
        "Extracted {} raw lines from {} pages of '{}'", lines.size(), pageCount, documentName);
    return lines;
  }
}
