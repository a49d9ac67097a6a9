package com.flamingo.reporttable.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics for extraction and report processing.
 *
 * <p>Counters are registered where they are incremented: {@code table_extractions_total} by
 * outcome, {@code contact_lookups_total} by result and {@code api_errors_total} by error type.
 */
@Configuration
public class MetricsConfig {

  /** Enables @Timed on the report service ({@code table.extraction}, {@code report.processing}). */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  @Bean
  public MeterRegistryCustomizer<MeterRegistry> applicationTag(
      @Value("${spring.application.name:report-table-extractor}") String applicationName) {
    return registry -> registry.config().commonTags("application", applicationName);
  }
}
