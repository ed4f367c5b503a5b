package com.flamingo.ai.deconstructor.service.parsing;

import com.flamingo.ai.deconstructor.segmentation.model.RawLine;
import java.io.InputStream;
import java.util.List;

/**
 * Extracts the ordered line stream of a paper.
 *
 * <p>Implementations produce lines in reading order (top to bottom, page by page) and tag each
 * line with its zero-based page. Blank lines are kept: the segmentation engine reads them as
 * paragraph and heading boundaries.
 */
public interface PaperTextExtractor {

  /**
   * Extracts the line stream.
   *
   * @param inputStream document content
   * @param documentName document name used in logs and errors
   * @return lines in reading order
   * @throws com.flamingo.ai.deconstructor.exception.DocumentProcessingException if the document
   *     cannot be read
   */
  List<RawLine> extract(InputStream inputStream, String documentName);

  /**
   * Whether this extractor handles the given MIME type.
   *
   * @param mimeType document MIME type (e.g. {@code application/pdf})
   */
  boolean supports(String mimeType);
}
