package com.scholary.storage.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for async task execution.
 *
 * <p>Image work, batch URL generation and listener delivery each run on their own bounded pool.
 * Sizes come from {@code storage.executors} and {@code storage.urls}.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "urlExecutor")
  public Executor urlExecutor(StorageProperties properties) {
    int threads = properties.urls().batchThreads();
    return executor("storage-url-", threads, threads * 100);
  }

  @Bean(name = "imageExecutor")
  public Executor imageExecutor(StorageProperties properties) {
    return executor(
        "storage-image-",
        properties.executors().imageThreads(),
        properties.executors().imageQueueSize());
  }

  @Bean(name = "listenerExecutor")
  public Executor listenerExecutor(StorageProperties properties) {
    return executor(
        "storage-listener-",
        properties.executors().listenerThreads(),
        properties.executors().listenerQueueSize());
  }

  private static ThreadPoolTaskExecutor executor(String prefix, int threads, int queueSize) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(queueSize);
    executor.setThreadNamePrefix(prefix);
    executor.initialize();
    return executor;
  }
}
