package com.flamingo.ai.olivia.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.servlet.config.annotation.AsyncSupportConfigurer;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Async request handling for SSE answer and progress streams.
 *
 * <p>The timeout set here is the only hard limit on a streamed answer; the orchestrator itself
 * stops pulling tokens when the transport cancels.
 */
@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

  @Value("${app.sse.timeout-ms:120000}")
  private long sseTimeoutMs;

  @Override
  public void configureAsyncSupport(AsyncSupportConfigurer configurer) {
    configurer.setTaskExecutor(asyncTaskExecutor());
    configurer.setDefaultTimeout(sseTimeoutMs);
  }

  @Bean(name = "asyncTaskExecutor")
  public AsyncTaskExecutor asyncTaskExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(5);
    executor.setMaxPoolSize(20);
    executor.setQueueCapacity(50);
    executor.setThreadNamePrefix("async-sse-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }
}
