package com.flamingo.ai.deconstructor.service.parsing;

import com.flamingo.ai.deconstructor.exception.DocumentProcessingException;
import com.flamingo.ai.deconstructor.segmentation.model.RawLine;
import java.io.InputStream;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Fallback {@link PaperTextExtractor} that uses Apache Tika's plain-text extraction.
 *
 * <p>Registered at {@code @Order(100)}, lowest priority, and supports every MIME type. Form-feed
 * characters in the extracted text start a new page; without them the whole document is page 0.
 * The extracted text is not length-limited, so the tail of a long paper is kept.
 */
@Service
@Order(100)
@Slf4j
public class TikaPaperTextExtractor implements PaperTextExtractor {

  private static final Tika TIKA = unlimitedTika();

  @Override
  public List<RawLine> extract(InputStream inputStream, String documentName) {
    String fullText;
    try {
      fullText = TIKA.parseToString(inputStream);
    } catch (Exception e) {
      log.error("Tika plain-text extraction failed for '{}': {}", documentName, e.getMessage());
      throw new DocumentProcessingException(
          documentName, "Failed to extract text: " + e.getMessage(), e);
    }
    List<RawLine> lines = RawLine.fromText(fullText);
    log.debug("Extracted {} raw lines from '{}' via Tika", lines.size(), documentName);
    return lines;
  }

  private static Tika unlimitedTika() {
    Tika tika = new Tika();
    tika.setMaxStringLength(-1);
    return tika;
  }

  @Override
  public boolean supports(String mimeType) {
    // Catch-all fallback
    return true;
  }
}
