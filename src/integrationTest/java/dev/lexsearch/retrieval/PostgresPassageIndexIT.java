package dev.lexsearch.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.lexsearch.BaseIntegrationTest;
import dev.lexsearch.passage.Passage;
import dev.lexsearch.passage.PassageFilter;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class PostgresPassageIndexIT extends BaseIntegrationTest {

  @Autowired PassageIndex passageIndex;

  @Autowired EmbeddingModel embeddingModel;

  static final String MURDER =
      "Whoever commits murder shall be punished with death or imprisonment.";
  static final String THEFT = "Whoever commits theft shall be punished with imprisonment.";
  static final String PROPERTY =
      "No person shall be deprived of his property save by authority of law.";

  @BeforeEach
  void seed() {
    passageIndex.addAll(
        List.of(
            passage("ipc-302", "ipc", "Penal Code", "Punishment for murder", MURDER, 1860, "act"),
            passage("ipc-379", "ipc", "Penal Code", "Punishment for theft", THEFT, 1860, "act"),
            passage(
                "coi-300a",
                "coi",
                "Constitution",
                "Right to property",
                PROPERTY,
                1950,
                "constitution")));
  }

  private Passage passage(
      String id,
      String documentId,
      String title,
      String heading,
      String text,
      int year,
      String category) {
    Embedding embedding = embeddingModel.embed(text).content();
    return new Passage(id, documentId, title, heading, text, null, embedding, year, category);
  }

  @Test
  void storesAllPassages() {
    assertThat(passageIndex.size()).isEqualTo(3);
  }

  @Test
  void lexicalSearchRanksHeadingMatchesFirst() {
    List<LexicalHit> hits = passageIndex.lexicalSearch("murder", PassageFilter.NONE, 10);

    assertThat(hits).extracting(hit -> hit.passage().id()).containsExactly("ipc-302");
    assertThat(hits.get(0).score()).isPositive();
    assertThat(hits.get(0).passage().title()).isEqualTo("Penal Code");
  }

  @Test
  void lexicalSearchWithoutMatchesIsEmpty() {
    assertThat(passageIndex.lexicalSearch("xylophone", PassageFilter.NONE, 10)).isEmpty();
  }

  @Test
  void lexicalSearchAppliesFilters() {
    assertThat(passageIndex.lexicalSearch("punished", PassageFilter.byYear(1860), 10))
        .extracting(hit -> hit.passage().id())
        .containsExactlyInAnyOrder("ipc-302", "ipc-379");
    assertThat(
            passageIndex.lexicalSearch("punished", PassageFilter.byCategory("constitution"), 10))
        .isEmpty();
  }

  @Test
  void semanticSearchReturnsExactMatchAtZeroDistance() {
    Embedding query = embeddingModel.embed(PROPERTY).content();

    List<SemanticHit> hits = passageIndex.semanticSearch(query, PassageFilter.NONE, 2);

    assertThat(hits).hasSize(2);
    assertThat(hits.get(0).passage().id()).isEqualTo("coi-300a");
    assertThat(hits.get(0).distance()).isCloseTo(0.0, within(1e-4));
    assertThat(hits.get(1).distance()).isGreaterThanOrEqualTo(hits.get(0).distance());
  }

  @Test
  void semanticSearchRoundTripsEmbeddingAndMetadata() {
    Embedding query = embeddingModel.embed(MURDER).content();

    Passage stored = passageIndex.semanticSearch(query, PassageFilter.NONE, 1).get(0).passage();

    assertThat(stored.year()).isEqualTo(1860);
    assertThat(stored.category()).isEqualTo("act");
    assertThat(stored.heading()).isEqualTo("Punishment for murder");
    assertThat(stored.contextText()).isEqualTo(MURDER);
    assertThat(stored.dimension()).isEqualTo(384);
  }

  @Test
  void reAddingPassageReplacesIt() {
    Passage amended =
        passage("ipc-302", "ipc", "Penal Code", "Murder", "Amended text.", 1860, "act");

    passageIndex.addAll(List.of(amended));

    assertThat(passageIndex.size()).isEqualTo(3);
    assertThat(passageIndex.lexicalSearch("amended", PassageFilter.NONE, 10))
        .extracting(hit -> hit.passage().id())
        .containsExactly("ipc-302");
  }

  @Test
  void rejectsQueryOfWrongDimension() {
    assertThatThrownBy(
            () ->
                passageIndex.semanticSearch(
                    Embedding.from(new float[] {1f, 0f}), PassageFilter.NONE, 5))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
