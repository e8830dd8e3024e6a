package com.flamingo.ai.olivia.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for application metrics. */
@Configuration
public class MetricsConfig {

  @Value("${spring.application.name:olivia}")
  private String applicationName;

  /** Enables {@code @Timed} on service methods. */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  /** Tags every meter with the application name so dashboards can tell instances apart. */
  @Bean
  public MeterRegistryCustomizer<MeterRegistry> commonTags() {
    return registry -> registry.config().commonTags("application", applicationName);
  }
}
