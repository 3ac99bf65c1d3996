package dev.lexsearch.ingestion;

import static org.assertj.core.api.Assertions.assertThat;

import dev.lexsearch.BaseIntegrationTest;
import dev.lexsearch.retrieval.PassageIndex;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;

class CorpusIngestionIT extends BaseIntegrationTest {

  @Autowired CorpusIngestionService ingestionService;

  @Autowired PassageIndex passageIndex;

  @TempDir Path tempDir;

  @Test
  void ingestsJsonlCorpusIntoPostgres() throws IOException {
    Path corpus = tempDir.resolve("corpus.jsonl");
    Files.write(
        corpus,
        List.of(
            "{\"title\":\"Penal Code\",\"year\":1860,\"category\":\"act\","
                + "\"heading\":\"Section 302\","
                + "\"text\":\"Whoever commits murder shall be punished.\"}",
            "not json",
            "{\"title\":\"Transfer of Property Act\",\"year\":1882,\"category\":\"act\","
                + "\"text\":\"" + "Property may be transferred by sale. ".repeat(80) + "\"}"));

    IngestionReport report = ingestionService.ingest(corpus);

    assertThat(report.documents()).isEqualTo(2);
    assertThat(report.skippedLines()).isEqualTo(1);
    assertThat(report.passages()).isGreaterThan(2);
    assertThat(passageIndex.size()).isEqualTo(report.passages());
    assertThat(jdbcTemplate.queryForObject("SELECT count(*) FROM documents", Integer.class))
        .isEqualTo(2);
  }

  @Test
  void reingestingIsIdempotent() throws IOException {
    Path corpus = tempDir.resolve("corpus.jsonl");
    Files.write(
        corpus,
        List.of("{\"title\":\"Contract Act\",\"text\":\"Consent is free when uncoerced.\"}"));

    ingestionService.ingest(corpus);
    ingestionService.ingest(corpus);

    assertThat(passageIndex.size()).isEqualTo(1);
  }
}
