package com.flamingo.ai.museumguide.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.servlet.config.annotation.AsyncSupportConfigurer;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/** Web MVC configuration for async request handling (SSE streaming). */
@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private final RagConfig ragConfig;

  @Override
  public void configureAsyncSupport(AsyncSupportConfigurer configurer) {
    configurer.setTaskExecutor(sseTaskExecutor());
    configurer.setDefaultTimeout(ragConfig.getStreaming().getTimeoutMs());
  }

  /**
   * Caller-facing pool that writes SSE responses, sized to the expected number of concurrent
   * visitor streams.
   *
   * @return configured thread pool task executor
   */
  @Bean(name = "sseTaskExecutor")
  public AsyncTaskExecutor sseTaskExecutor() {
    RagConfig.Streaming streaming = ragConfig.getStreaming();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(streaming.getCorePoolSize());
    executor.setMaxPoolSize(streaming.getMaxPoolSize());
    executor.setQueueCapacity(streaming.getQueueCapacity());
    executor.setThreadNamePrefix("async-sse-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(60);
    executor.initialize();
    return executor;
  }
}
