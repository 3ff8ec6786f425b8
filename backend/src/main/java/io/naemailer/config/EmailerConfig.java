package io.naemailer.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.naemailer.filter.FilterSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EmailerConfig {

  private static final Logger log = LoggerFactory.getLogger(EmailerConfig.class);

  /** Parsed once; an invalid filter stops startup instead of failing every request. */
  @Bean
  FilterSpec filterSpec(EmailerProperties properties, ObjectMapper objectMapper) {
    try {
      var spec = FilterSpec.parse(properties.filtersJson(), objectMapper);
      log.info(
          "Event filter configured: predicates={}, mode={}",
          spec.predicates().size(),
          properties.filterMode());
      return spec;
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException("Invalid na.filters-json: " + e.getMessage(), e);
    }
  }
}
