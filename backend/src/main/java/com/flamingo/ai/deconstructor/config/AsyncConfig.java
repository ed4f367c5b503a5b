package com.flamingo.ai.deconstructor.config;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for batch paper processing. */
@Configuration
public class AsyncConfig {

  /**
   * Runs one independent segmentation pipeline per document. When the queue is full the
   * submitting thread runs the document itself, so a batch of any size completes.
   */
  @Bean(name = "paperProcessingExecutor")
  public Executor paperProcessingExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(100);
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.setThreadNamePrefix("paper-proc-");
    executor.initialize();
    return executor;
  }
}
