package dev.lexsearch.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;

import dev.langchain4j.data.embedding.Embedding;
import dev.lexsearch.fixture.PassageBuilder;
import dev.lexsearch.passage.Passage;
import dev.lexsearch.passage.PassageFilter;
import dev.lexsearch.passage.PassageRepository;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PostgresPassageIndexTest {

  @Mock PassageRepository repository;

  private static Object[] row(String id, Object score) {
    return new Object[] {
      id, "doc-1", "Penal Code", "Section 302", "text of " + id, null, "[0.6,0.8]", 1860, "act",
      score
    };
  }

  @Test
  void vectorLiteralRoundTripsThroughPgvectorTextForm() {
    Embedding embedding = Embedding.from(new float[] {0.25f, -1.5f, 3.0f});

    String literal = PostgresPassageIndex.toVectorLiteral(embedding);

    assertThat(literal).isEqualTo("[0.25,-1.5,3.0]");
    assertThat(PostgresPassageIndex.parseVectorLiteral(literal).vector())
        .containsExactly(0.25f, -1.5f, 3.0f);
  }

  @Test
  void parsesPgvectorOutputWithSpaces() {
    assertThat(PostgresPassageIndex.parseVectorLiteral("[1, 2 ,3]").vector())
        .containsExactly(1f, 2f, 3f);
    assertThat(PostgresPassageIndex.parseVectorLiteral("[]").dimension()).isZero();
    assertThat(PostgresPassageIndex.parseVectorLiteral(null).dimension()).isZero();
  }

  @Test
  void mapsSearchRowToPassage() {
    Passage passage = PostgresPassageIndex.toPassage(row("p1", 0.5f));

    assertThat(passage.id()).isEqualTo("p1");
    assertThat(passage.documentId()).isEqualTo("doc-1");
    assertThat(passage.title()).isEqualTo("Penal Code");
    assertThat(passage.heading()).isEqualTo("Section 302");
    assertThat(passage.text()).isEqualTo("text of p1");
    assertThat(passage.parentText()).isNull();
    assertThat(passage.contextText()).isEqualTo("text of p1");
    assertThat(passage.embedding().vector()).containsExactly(0.6f, 0.8f);
    assertThat(passage.year()).isEqualTo(1860);
    assertThat(passage.category()).isEqualTo("act");
  }

  @Test
  void lexicalSearchPassesFilterToRepository() {
    var index = new PostgresPassageIndex(repository, 2);
    given(repository.lexicalSearch("murder", 1860, "act", 5))
        .willReturn(List.<Object[]>of(row("p1", 0.5f), row("p2", 0.25)));

    List<LexicalHit> hits = index.lexicalSearch("murder", new PassageFilter(1860, "act"), 5);

    assertThat(hits).extracting(h -> h.passage().id()).containsExactly("p1", "p2");
    assertThat(hits).extracting(LexicalHit::score).containsExactly(0.5, 0.25);
  }

  @Test
  void blankQueryDoesNotHitTheDatabase() {
    var index = new PostgresPassageIndex(repository, 2);

    assertThat(index.lexicalSearch("  ", PassageFilter.NONE, 5)).isEmpty();
    then(repository).should(never()).lexicalSearch(anyString(), any(), any(), anyInt());
  }

  @Test
  void semanticSearchSendsQueryVectorAsLiteral() {
    var index = new PostgresPassageIndex(repository, 2);
    given(repository.semanticSearch("[1.0,0.0]", null, null, 3))
        .willReturn(List.<Object[]>of(row("p1", 0.1)));

    List<SemanticHit> hits =
        index.semanticSearch(Embedding.from(new float[] {1f, 0f}), PassageFilter.NONE, 3);

    assertThat(hits).extracting(SemanticHit::distance).containsExactly(0.1);
  }

  @Test
  void semanticSearchWidensHnswScanBeforeQuerying() {
    var index = new PostgresPassageIndex(repository, 2, Duration.ofMillis(750));
    given(repository.semanticSearch("[1.0,0.0]", null, "act", 200)).willReturn(List.of());

    index.semanticSearch(
        Embedding.from(new float[] {1f, 0f}), PassageFilter.byCategory("act"), 200);

    InOrder inOrder = inOrder(repository);
    inOrder.verify(repository).setLocal("statement_timeout", "750");
    inOrder.verify(repository).setLocal("hnsw.ef_search", "200");
    inOrder.verify(repository).setLocal("hnsw.iterative_scan", "strict_order");
    inOrder.verify(repository).semanticSearch("[1.0,0.0]", null, "act", 200);
  }

  @Test
  void lexicalSearchBoundsStatementTime() {
    var index = new PostgresPassageIndex(repository, 2, Duration.ofMillis(120));
    given(repository.lexicalSearch("murder", null, null, 5)).willReturn(List.of());

    index.lexicalSearch("murder", PassageFilter.NONE, 5);

    then(repository).should().setLocal("statement_timeout", "120");
    then(repository).should(never()).setLocal(eq("hnsw.ef_search"), anyString());
  }

  @Test
  void efSearchFollowsLimitWithinPgvectorBounds() {
    assertThat(PostgresPassageIndex.efSearch(5)).isEqualTo(PostgresPassageIndex.DEFAULT_EF_SEARCH);
    assertThat(PostgresPassageIndex.efSearch(300)).isEqualTo(300);
    assertThat(PostgresPassageIndex.efSearch(5_000)).isEqualTo(PostgresPassageIndex.MAX_EF_SEARCH);
  }

  @Test
  void semanticSearchRejectsWrongDimension() {
    var index = new PostgresPassageIndex(repository, 384);

    assertThatThrownBy(
            () -> index.semanticSearch(Embedding.from(new float[] {1f}), PassageFilter.NONE, 3))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void addAllUpsertsEachDocumentOnceThenEveryPassage() {
    var index = new PostgresPassageIndex(repository, 2);
    List<Passage> passages =
        List.of(
            new PassageBuilder().id("a-0").documentId("a").embedding(1f, 0f).build(),
            new PassageBuilder().id("a-1").documentId("a").embedding(0f, 1f).build(),
            new PassageBuilder().id("b-0").documentId("b").embedding(1f, 1f).build());

    index.addAll(passages);

    then(repository).should(times(1)).upsertDocument(eq("a"), any(), any(), any(), any());
    then(repository).should(times(1)).upsertDocument(eq("b"), any(), any(), any(), any());
    then(repository)
        .should()
        .upsertPassage(
            eq("a-1"),
            eq("a"),
            eq("Section 1"),
            eq("Sample passage text for testing."),
            any(),
            eq("[0.0,1.0]"),
            any(),
            any(),
            eq(5));
  }
}
