package dev.lexsearch.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for the concurrent retrieval calls and reranker invocations of the search pipeline.
 */
@Configuration
public class ExecutorConfig {

  @Bean
  public ThreadPoolTaskExecutor searchExecutor(
      @Value("${lexsearch.search.executor-threads:8}") int threads) {
    if (threads < 1) {
      throw new IllegalStateException(
          "lexsearch.search.executor-threads must be at least 1, got: " + threads);
    }
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(Integer.MAX_VALUE);
    executor.setThreadNamePrefix("search-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    return executor;
  }
}
