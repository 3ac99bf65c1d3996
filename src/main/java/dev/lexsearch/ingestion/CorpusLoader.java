package dev.lexsearch.ingestion;

import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Ingests the corpus at {@code lexsearch.corpus.path} once the application has started. */
@Component
@ConditionalOnProperty(name = "lexsearch.corpus.path")
public class CorpusLoader implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(CorpusLoader.class);

  private final CorpusIngestionService ingestionService;
  private final Path corpusPath;

  public CorpusLoader(
      CorpusIngestionService ingestionService, @Value("${lexsearch.corpus.path}") Path corpusPath) {
    this.ingestionService = ingestionService;
    this.corpusPath = corpusPath;
  }

  @Override
  public void run(ApplicationArguments args) {
    log.info("Loading corpus from {}", corpusPath);
    ingestionService.ingest(corpusPath);
  }
}
