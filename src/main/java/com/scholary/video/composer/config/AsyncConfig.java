package com.scholary.video.composer.config;

import com.scholary.video.composer.sequencer.SequencerProperties;
import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for background execution.
 *
 * <p>Polling and compositing get separate bounded pools so a burst of slow encodes never delays
 * status polling. A full queue rejects work instead of growing without bound.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "pollerExecutor")
  public Executor pollerExecutor(SequencerProperties properties) {
    return boundedExecutor(
        properties.pollerThreads(), properties.pollerQueueSize(), "prediction-poll-");
  }

  @Bean(name = "compositingExecutor")
  public Executor compositingExecutor(SequencerProperties properties) {
    return boundedExecutor(
        properties.compositingThreads(), properties.compositingQueueSize(), "compositing-");
  }

  private static ThreadPoolTaskExecutor boundedExecutor(
      int threads, int queueSize, String threadNamePrefix) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(queueSize);
    executor.setThreadNamePrefix(threadNamePrefix);
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }
}
