package com.flamingo.ai.chatstream.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Micrometer wiring for the stream pipeline. Counters and gauges are registered by the components
 * themselves; this class only adds the aspect behind {@code @Timed} on stream start, provider open
 * and message flushes.
 */
@Configuration
public class MetricsConfig {

  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }
}
