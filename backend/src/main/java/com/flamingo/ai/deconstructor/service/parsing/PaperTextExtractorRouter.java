package com.flamingo.ai.deconstructor.service.parsing;

import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.springframework.stereotype.Service;

/**
 * Routes a document MIME type to the highest-priority {@link PaperTextExtractor} that supports it.
 *
 * <p>Extractors are injected by Spring in {@code @Order} order (ascending). The router picks the
 * first extractor that returns {@code true} for {@code supports(mimeType)}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaperTextExtractorRouter {

  private static final String OCTET_STREAM = "application/octet-stream";
  private static final Tika TIKA = new Tika();

  private final List<PaperTextExtractor> extractors;

  /**
   * Returns the highest-priority extractor that supports the given MIME type.
   *
   * @param mimeType document MIME type
   * @return selected extractor
   * @throws IllegalStateException if no extractor supports the MIME type
   */
  public PaperTextExtractor route(String mimeType) {
    return extractors.stream()
        .filter(e -> e.supports(mimeType))
        .findFirst()
        .orElseThrow(
            () ->
                new IllegalStateException(
                    "No PaperTextExtractor found for MIME type: " + mimeType));
  }

  /**
   * Resolves the MIME type of an upload, falling back to detection by file name when the client
   * sent none or a generic one.
   */
  public String resolveMimeType(String declaredMimeType, String fileName) {
    if (declaredMimeType != null
        && !declaredMimeType.isBlank()
        && !OCTET_STREAM.equalsIgnoreCase(declaredMimeType)) {
      return declaredMimeType;
    }
    if (fileName == null || fileName.isBlank()) {
      return OCTET_STREAM;
    }
    String detected = TIKA.detect(fileName);
    log.debug("Detected MIME type {} for '{}'", detected, fileName);
    return detected;
  }
}
