package com.flamingo.ai.chatstream.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/** Configuration for stream writer threads and scheduled maintenance jobs. */
@Configuration
@EnableScheduling
public class AsyncConfig {

  /**
   * Scheduler that runs stream writers and buffer readers. Buffer and message writes block on JDBC,
   * so they never run on reactor-netty event loop threads.
   */
  @Bean(name = "streamScheduler", destroyMethod = "dispose")
  public Scheduler streamScheduler() {
    return Schedulers.newBoundedElastic(64, 10_000, "stream-writer");
  }
}
