package com.flamingo.ai.deconstructor.config;

import com.flamingo.ai.deconstructor.segmentation.HeadingAliasTable;
import com.flamingo.ai.deconstructor.segmentation.SegmentationConfig;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for segmentation, summarization and report rendering. */
@Configuration
@ConfigurationProperties(prefix = "deconstructor")
@Getter
@Setter
public class DeconstructorConfig {

  private Segmentation segmentation = new Segmentation();
  private Summary summary = new Summary();
  private Report report = new Report();

  @Getter
  @Setter
  public static class Segmentation {
    private int maxHeadingLength = 60;
    private double minConfidence = 0.3;

    /** Content lines a heading needs before the next candidate; fewer marks a TOC entry. */
    private int minContentGap = 1;

    /** Share of the document scanned for contribution sentences without abstract/introduction. */
    private double contributionScopeFraction = 0.4;

    private int fallbackSentenceCount = 2;
    private String contributionSeparator = " ";
    private int maxPageNumberLength = 4;
    private int maxMetadataLineLength = 120;
    private List<String> cuePhrases = new ArrayList<>(SegmentationConfig.DEFAULT_CUE_PHRASES);
    private List<String> metadataKeywords =
        new ArrayList<>(SegmentationConfig.DEFAULT_METADATA_KEYWORDS);

    public SegmentationConfig toSegmentationConfig(HeadingAliasTable aliasTable) {
      return SegmentationConfig.builder()
          .aliasTable(aliasTable)
          .maxHeadingLength(maxHeadingLength)
          .minConfidence(minConfidence)
          .minContentGap(minContentGap)
          .contributionScopeFraction(contributionScopeFraction)
          .fallbackSentenceCount(fallbackSentenceCount)
          .contributionSeparator(contributionSeparator)
          .maxPageNumberLength(maxPageNumberLength)
          .maxMetadataLineLength(maxMetadataLineLength)
          .cuePhrases(cuePhrases)
          .metadataKeywords(metadataKeywords)
          .build();
    }
  }

  @Getter
  @Setter
  public static class Summary {
    /** Lower bound, in words, passed to the summarizer when the caller gives none. */
    private int minLength = 40;

    private int maxLength = 150;

    /** Input is summarized in chunks of at most this many characters. */
    private int maxChunkChars = 1024;
  }

  @Getter
  @Setter
  public static class Report {
    /** Sections copied into the report as extracted instead of summarized. */
    private List<String> verbatimSections =
        new ArrayList<>(List.of("title", "abstract", "contribution", "references"));

    /** Render a "not found" note for requested sections that are absent. */
    private boolean includeMissingSections = true;
  }
}
