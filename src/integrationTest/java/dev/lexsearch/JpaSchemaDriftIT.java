package dev.lexsearch;

import static org.assertj.core.api.Assertions.assertThat;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.lexsearch.passage.Passage;
import dev.lexsearch.passage.PassageEntity;
import dev.lexsearch.passage.PassageRepository;
import dev.lexsearch.retrieval.PassageIndex;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

/**
 * Compensates for ddl-auto=none by verifying the passage entity reads back rows written by the
 * native upserts against the Flyway schema.
 */
class JpaSchemaDriftIT extends BaseIntegrationTest {

  @Autowired private PassageIndex passageIndex;

  @Autowired private PassageRepository passageRepository;

  @Autowired private EmbeddingModel embeddingModel;

  @Test
  void passageEntityReadsRowsWrittenByNativeUpsert() {
    String text = "Whoever commits murder shall be punished.";
    passageIndex.addAll(
        List.of(
            new Passage(
                "ipc-302",
                "ipc",
                "Penal Code",
                "Section 302",
                text,
                "Chapter XVI. " + text,
                embeddingModel.embed(text).content(),
                1860,
                "act")));

    PassageEntity found = passageRepository.findById("ipc-302").orElseThrow();

    assertThat(found.getDocumentId()).isEqualTo("ipc");
    assertThat(found.getHeading()).isEqualTo("Section 302");
    assertThat(found.getText()).isEqualTo(text);
    assertThat(found.getParentText()).isEqualTo("Chapter XVI. " + text);
    assertThat(found.getYear()).isEqualTo(1860);
    assertThat(found.getCategory()).isEqualTo("act");
    assertThat(found.getTokenCount()).isEqualTo(6);
    assertThat(found.getCreatedAt()).isNotNull();
  }
}
