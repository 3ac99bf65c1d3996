package dev.lexsearch.config;

import dev.lexsearch.passage.PassageRepository;
import dev.lexsearch.retrieval.InMemoryPassageIndex;
import dev.lexsearch.retrieval.PassageIndex;
import dev.lexsearch.retrieval.PostgresPassageIndex;
import dev.lexsearch.search.SearchProperties;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Selects the candidate source from {@code lexsearch.store.type}: {@code POSTGRES} (default) or
 * {@code MEMORY}. The in-memory store needs no data source; run it with the {@code memory} profile,
 * which disables the JPA and Flyway auto-configuration.
 */
@Configuration
@EnableRetry
public class StoreConfig {

  private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

  @Bean
  @ConditionalOnProperty(
      name = "lexsearch.store.type",
      havingValue = "POSTGRES",
      matchIfMissing = true)
  public PassageIndex postgresPassageIndex(
      PassageRepository passageRepository,
      ModelProperties modelProperties,
      SearchProperties searchProperties) {
    log.info("Candidate source: PostgreSQL (pgvector + full-text)");
    return new PostgresPassageIndex(
        passageRepository,
        modelProperties.embedding().dimension(),
        Duration.ofMillis(searchProperties.getRetrievalTimeoutMs()));
  }

  @Bean
  @ConditionalOnProperty(name = "lexsearch.store.type", havingValue = "MEMORY")
  public PassageIndex inMemoryPassageIndex(ModelProperties modelProperties) {
    log.info("Candidate source: in-memory");
    return new InMemoryPassageIndex(modelProperties.embedding().dimension());
  }
}
