package com.flamingo.ai.olivia.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Thread pools for ingestion and for blocking work offloaded from request pipelines. */
@Configuration
@EnableAsync
@EnableScheduling
public class AsyncConfig {

  @Bean(name = "documentProcessingExecutor")
  public Executor documentProcessingExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("doc-ingest-");
    executor.initialize();
    return executor;
  }

  /**
   * Runs embedding, vector-index and generation calls so that reactive request pipelines never
   * block their own threads.
   */
  @Bean(name = "ragExecutor")
  public Executor ragExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(8);
    executor.setMaxPoolSize(32);
    executor.setQueueCapacity(200);
    executor.setThreadNamePrefix("rag-");
    executor.initialize();
    return executor;
  }
}
