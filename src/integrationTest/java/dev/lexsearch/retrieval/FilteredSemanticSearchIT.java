package dev.lexsearch.retrieval;

import static org.assertj.core.api.Assertions.assertThat;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.lexsearch.BaseIntegrationTest;
import dev.lexsearch.passage.Passage;
import dev.lexsearch.passage.PassageFilter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Semantic search over more passages than pgvector's default HNSW candidate list. Sequential scans
 * are disabled so the planner has to answer the ordered query from the HNSW index.
 */
class FilteredSemanticSearchIT extends BaseIntegrationTest {

  private static final int PASSAGES = 300;
  private static final int RARE_EVERY = 6;

  @Autowired PassageIndex passageIndex;

  @Autowired EmbeddingModel embeddingModel;

  @Autowired PlatformTransactionManager transactionManager;

  @BeforeEach
  void seed() {
    List<Passage> passages = new ArrayList<>();
    for (int i = 0; i < PASSAGES; i++) {
      String text = "Clause " + i + " governs the transfer of holding number " + (i * 7919 % 1000);
      Embedding embedding = embeddingModel.embed(text).content();
      String category = i % RARE_EVERY == 0 ? "rare" : "common";
      passages.add(
          new Passage(
              "clause-" + i,
              "doc-" + (i / 50),
              "Transfer Act",
              "Clause " + i,
              text,
              null,
              embedding,
              1990,
              category));
    }
    passageIndex.addAll(passages);
  }

  private List<SemanticHit> searchOnIndexOnly(PassageFilter filter, int limit) {
    Embedding query = embeddingModel.embed("transfer of holding").content();
    return new TransactionTemplate(transactionManager)
        .execute(
            status -> {
              jdbcTemplate.execute("SET LOCAL enable_seqscan = off");
              return passageIndex.semanticSearch(query, filter, limit);
            });
  }

  @Test
  void unfilteredSearchReturnsMoreRowsThanDefaultCandidateList() {
    List<SemanticHit> hits = searchOnIndexOnly(PassageFilter.NONE, 200);

    assertThat(hits).hasSize(200);
    assertThat(hits).isSortedAccordingTo(Comparator.comparingDouble(SemanticHit::distance));
  }

  @Test
  void selectiveFilterStillReturnsEveryMatchingPassage() {
    List<SemanticHit> hits = searchOnIndexOnly(PassageFilter.byCategory("rare"), 200);

    assertThat(hits).hasSize(PASSAGES / RARE_EVERY);
    assertThat(hits).allSatisfy(hit -> assertThat(hit.passage().category()).isEqualTo("rare"));
    assertThat(hits).isSortedAccordingTo(Comparator.comparingDouble(SemanticHit::distance));
  }

  @Test
  void filteredSearchHonoursLimit() {
    assertThat(searchOnIndexOnly(PassageFilter.byCategory("common"), 120)).hasSize(120);
  }
}
