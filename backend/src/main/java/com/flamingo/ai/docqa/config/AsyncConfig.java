package com.flamingo.ai.docqa.config;

import java.util.concurrent.ExecutorService;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pools for the pipeline. Ingestion, query and generation run on separate pools so a slow
 * model call cannot starve document processing.
 */
@Configuration
@RequiredArgsConstructor
public class AsyncConfig {

  private final RagConfig ragConfig;

  @Bean(name = "ingestionExecutor", destroyMethod = "shutdownNow")
  public ExecutorService ingestionExecutor() {
    RagConfig.Ingestion ingestion = ragConfig.getIngestion();
    return pool(
        ingestion.getCorePoolSize(),
        ingestion.getMaxPoolSize(),
        ingestion.getQueueCapacity(),
        "ingest-");
  }

  @Bean(name = "queryExecutor", destroyMethod = "shutdownNow")
  public ExecutorService queryExecutor() {
    return pool(5, 20, 50, "query-");
  }

  @Bean(name = "generationExecutor", destroyMethod = "shutdownNow")
  public ExecutorService generationExecutor() {
    return pool(5, 20, 50, "generate-");
  }

  private static ExecutorService pool(int core, int max, int queue, String prefix) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(core);
    executor.setMaxPoolSize(max);
    executor.setQueueCapacity(queue);
    executor.setThreadNamePrefix(prefix);
    executor.initialize();
    return executor.getThreadPoolExecutor();
  }
}
