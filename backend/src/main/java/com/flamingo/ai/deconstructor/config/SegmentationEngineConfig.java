package com.flamingo.ai.deconstructor.config;

import com.flamingo.ai.deconstructor.segmentation.HeadingAliasTable;
import com.flamingo.ai.deconstructor.segmentation.SectionSegmentationEngine;
import com.flamingo.ai.deconstructor.segmentation.SegmentationConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the Spring-independent segmentation engine from externalized configuration. */
@Configuration
public class SegmentationEngineConfig {

  @Bean
  public HeadingAliasTable headingAliasTable() {
    return HeadingAliasTable.english();
  }

  @Bean
  public SegmentationConfig segmentationConfig(
      DeconstructorConfig deconstructorConfig, HeadingAliasTable headingAliasTable) {
    return deconstructorConfig.getSegmentation().toSegmentationConfig(headingAliasTable);
  }

  @Bean
  public SectionSegmentationEngine sectionSegmentationEngine(
      SegmentationConfig segmentationConfig) {
    return new SectionSegmentationEngine(segmentationConfig);
  }
}
