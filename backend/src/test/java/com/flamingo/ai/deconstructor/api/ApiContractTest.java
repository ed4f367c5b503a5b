package com.flamingo.ai.deconstructor.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.deconstructor.api.rest.PaperController;
import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.Objects;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests to verify the paper endpoints keep their documented paths:
 *
 * <ul>
 *   <li>POST /api/papers/sections - Segment an uploaded paper
 *   <li>POST /api/papers/sections/batch - Segment several uploaded papers
 *   <li>POST /api/papers/report - Build a report over requested sections
 * </ul>
 */
class ApiContractTest {

  @Nested
  @DisplayName("PaperController API contract")
  class PaperControllerContract {

    @Test
    @DisplayName("should be mapped to /api/papers")
    void shouldBeMappedToApiPapers() {
      RequestMapping mapping = PaperController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/papers");
    }

    @Test
    @DisplayName("should expose multipart POST /sections, /sections/batch and /report")
    void shouldExposeMultipartPostEndpoints() {
      assertThat(
              Arrays.stream(PaperController.class.getDeclaredMethods())
                  .map(m -> m.getAnnotation(PostMapping.class))
                  .filter(Objects::nonNull)
                  .flatMap(a -> Arrays.stream(a.value())))
          .containsExactlyInAnyOrder("/sections", "/sections/batch", "/report");

      for (Method method : PaperController.class.getDeclaredMethods()) {
        PostMapping post = method.getAnnotation(PostMapping.class);
        if (post != null) {
          assertThat(post.consumes()).containsExactly(MediaType.MULTIPART_FORM_DATA_VALUE);
        }
      }
    }
  }
}
