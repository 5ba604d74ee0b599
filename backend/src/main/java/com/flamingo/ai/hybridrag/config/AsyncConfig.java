package com.flamingo.ai.hybridrag.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Executors for pipeline invocations and the parallel retrieval legs inside each of them. */
@Configuration
public class AsyncConfig {

  @Bean(name = "pipelineExecutor")
  public ThreadPoolTaskExecutor pipelineExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(16);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("pipeline-");
    executor.initialize();
    return executor;
  }

  // Separate pool: pipeline workers block on retrieval futures and must not starve them.
  @Bean(name = "retrievalExecutor")
  public ThreadPoolTaskExecutor retrievalExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(8);
    executor.setMaxPoolSize(32);
    executor.setQueueCapacity(200);
    executor.setThreadNamePrefix("retrieval-");
    executor.initialize();
    return executor;
  }
}
