package com.flamingo.ai.museumguide.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics wiring. Retrieval, generation and orchestration meters are tagged with the application
 * name so several guide instances can share one backend.
 */
@Configuration
public class MetricsConfig {

  @Value("${spring.application.name:museum-guide}")
  private String applicationName;

  /** Lets {@code @Timed} on the embedding and generation calls record timers. */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  @Bean
  public MeterRegistryCustomizer<MeterRegistry> commonTags() {
    return registry -> registry.config().commonTags("application", applicationName);
  }
}
