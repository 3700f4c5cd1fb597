package com.flamingo.ai.museumguide.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Executors for the query pipeline. */
@Configuration
public class AsyncConfig {

  /**
   * Runs the context fetch and the retrieve-then-generate task of each query side by side.
   *
   * @param ragConfig pool sizing
   * @return the orchestration executor
   */
  @Bean(name = "orchestrationExecutor")
  public Executor orchestrationExecutor(RagConfig ragConfig) {
    RagConfig.Orchestration orchestration = ragConfig.getOrchestration();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(orchestration.getCorePoolSize());
    executor.setMaxPoolSize(orchestration.getMaxPoolSize());
    executor.setQueueCapacity(orchestration.getQueueCapacity());
    executor.setThreadNamePrefix("orch-");
    executor.initialize();
    return executor;
  }
}
