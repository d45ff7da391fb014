package com.scholary.subtitle.aligner.config;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for batch alignment.
 *
 * <p>Subtitle pairs are independent, so a batch submits one task per pair. Threads and queue
 * capacity come from {@link AlignmentProperties}.
 */
@Configuration
public class AsyncConfig {

  public static final String ALIGNMENT_EXECUTOR = "alignmentExecutor";

  @Bean(name = ALIGNMENT_EXECUTOR)
  public Executor alignmentExecutor(AlignmentProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.executorThreads());
    executor.setMaxPoolSize(properties.executorThreads());
    executor.setQueueCapacity(properties.executorQueueSize());
    executor.setThreadNamePrefix("alignment-");
    // A full queue runs the pair on the submitting thread; every pair must complete.
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.initialize();
    return executor;
  }
}
