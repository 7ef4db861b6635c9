package com.flamingo.ai.chatstream.config;

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

  private final StreamConfig streamConfig;

  /**
   * Configures async support for SSE streaming with a proper thread pool executor.
   *
   * <p>The async timeout must outlive both the generation limit and the resume limit, otherwise the
   * container would cut a stream before it reaches its terminal event.
   */
  @Override
  public void configureAsyncSupport(AsyncSupportConfigurer configurer) {
    long longest =
        Math.max(
            streamConfig.getUpstream().getMaxDuration().toMillis(),
            streamConfig.getResume().getMaxDuration().toMillis());
    configurer.setTaskExecutor(asyncTaskExecutor());
    configurer.setDefaultTimeout(longest + 30_000);
  }

  /** Executor that writes SSE events for live and resumed streams. */
  @Bean(name = "asyncTaskExecutor")
  public AsyncTaskExecutor asyncTaskExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(8);
    executor.setMaxPoolSize(64);
    executor.setQueueCapacity(streamConfig.getChannel().getCapacity());
    executor.setThreadNamePrefix("sse-writer-");
    // Streams are interrupted by the registry on shutdown; their terminal events still need a
    // thread to be written.
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(10);
    executor.initialize();
    return executor;
  }
}
