package dev.lexsearch.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import dev.lexsearch.model.HashingEmbeddingModel;
import dev.lexsearch.passage.Passage;
import dev.lexsearch.passage.PassageFilter;
import dev.lexsearch.retrieval.InMemoryPassageIndex;
import dev.lexsearch.retrieval.SemanticHit;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CorpusIngestionServiceTest {

  private static final Validator VALIDATOR =
      Validation.buildDefaultValidatorFactory().getValidator();

  @TempDir Path tempDir;

  private final HashingEmbeddingModel embeddingModel = new HashingEmbeddingModel(16);

  private InMemoryPassageIndex index;

  private CorpusIngestionService service;

  @BeforeEach
  void setUp() {
    index = new InMemoryPassageIndex(16);
    service = new CorpusIngestionService(index, embeddingModel, VALIDATOR, new ObjectMapper());
  }

  private Path corpus(String... lines) throws IOException {
    Path file = tempDir.resolve("corpus.jsonl");
    Files.write(file, List.of(lines));
    return file;
  }

  private Passage onlyPassage() {
    List<SemanticHit> hits =
        index.semanticSearch(embeddingModel.embed("any query").content(), PassageFilter.NONE, 10);
    assertThat(hits).hasSize(1);
    return hits.get(0).passage();
  }

  @Test
  void ingestsValidLinesAndCountsSkippedOnes() throws IOException {
    Path file =
        corpus(
            "{\"title\":\"Penal Code\",\"year\":1860,\"category\":\"act\","
                + "\"heading\":\"Section 302\","
                + "\"section_no\":\"302\",\"text\":\"Whoever commits murder shall be punished.\"}",
            "",
            "{not json",
            "{\"title\":\"Empty\",\"text\":\"   \"}",
            "{\"title\":\"Constitution\",\"category\":\"constitution\","
                + "\"text\":\"No person shall be deprived of property.\",\"source\":\"ignored\"}");

    IngestionReport report = service.ingest(file);

    assertThat(report).isEqualTo(new IngestionReport(2, 2, 2));
    assertThat(index.size()).isEqualTo(2);
  }

  @Test
  void passageCarriesMetadataAndFullTextAsParentContext() throws IOException {
    Path file =
        corpus(
            "{\"title\":\"Penal Code\",\"year\":1860,\"category\":\"act\","
                + "\"heading\":\"Section 302\","
                + "\"text\":\"Whoever commits murder shall be punished.\"}");

    service.ingest(file);

    Passage passage = onlyPassage();
    assertThat(passage.title()).isEqualTo("Penal Code");
    assertThat(passage.heading()).isEqualTo("Section 302");
    assertThat(passage.year()).isEqualTo(1860);
    assertThat(passage.category()).isEqualTo("act");
    assertThat(passage.text()).isEqualTo("Whoever commits murder shall be punished.");
    assertThat(passage.parentText()).isEqualTo("Whoever commits murder shall be punished.");
    assertThat(passage.id()).endsWith("-0");
  }

  @Test
  void passageIsEmbeddedWithTitleAndHeading() throws IOException {
    service.ingest(
        corpus(
            "{\"title\":\"Penal Code\",\"heading\":\"Section 302\",\"text\":\"Punishment.\"}"));

    Embedding expected = embeddingModel.embed("Penal Code\nSection 302\nPunishment.").content();
    List<SemanticHit> hits = index.semanticSearch(expected, PassageFilter.NONE, 1);

    assertThat(hits.get(0).distance()).isCloseTo(0.0, within(1e-5));
  }

  @Test
  void embedInputSkipsMissingTitleAndHeading() {
    var record = new CorpusRecord(null, null, null, null, null, "Body only.");

    assertThat(CorpusIngestionService.embedInput(record, "Body only.")).isEqualTo("Body only.");
  }

  @Test
  void longDocumentIsSplitIntoOverlappingChildPassages() {
    String text = "The owner may transfer property by sale. ".repeat(60);
    var record = new CorpusRecord("Transfer Act", 1882, "act", "Section 5", null, text);

    IngestionReport report = service.ingestRecords(List.of(record));

    assertThat(report.documents()).isEqualTo(1);
    assertThat(report.passages()).isGreaterThan(1);
    assertThat(index.size()).isEqualTo(report.passages());
    String documentId = CorpusIngestionService.documentId(record);
    assertThat(
            index.lexicalSearch("transfer", PassageFilter.NONE, 100).stream()
                .map(hit -> hit.passage())
                .toList())
        .allSatisfy(
            p -> {
              assertThat(p.documentId()).isEqualTo(documentId);
              assertThat(p.parentText()).isEqualTo(text);
              assertThat(p.text().length()).isLessThanOrEqualTo(1024);
            });
  }

  @Test
  void reingestingSameCorpusOverwritesInsteadOfDuplicating() throws IOException {
    Path file =
        corpus(
            "{\"title\":\"A\",\"text\":\"First document.\"}",
            "{\"title\":\"B\",\"text\":\"Second document.\"}");

    service.ingest(file);
    service.ingest(file);

    assertThat(index.size()).isEqualTo(2);
  }

  @Test
  void invalidRecordIsSkipped() {
    var negativeYear = new CorpusRecord("Bad", -5, null, null, null, "Some text.");
    var valid = new CorpusRecord("Good", 2001, null, null, null, "Some other text.");

    IngestionReport report = service.ingestRecords(List.of(negativeYear, valid));

    assertThat(report).isEqualTo(new IngestionReport(1, 1, 1));
  }

  @Test
  void embeddingFailureLeavesIndexUntouched() {
    EmbeddingModel failing = mock(EmbeddingModel.class);
    given(failing.embedAll(anyList())).willThrow(new IllegalStateException("model crashed"));
    var failingService =
        new CorpusIngestionService(index, failing, VALIDATOR, new ObjectMapper());

    assertThatThrownBy(
            () ->
                failingService.ingestRecords(
                    List.of(new CorpusRecord("A", null, null, null, null, "Text."))))
        .isInstanceOf(IllegalStateException.class);
    assertThat(index.size()).isZero();
  }

  @Test
  void embedsInBatches() {
    EmbeddingModel counting = mock(EmbeddingModel.class);
    given(counting.embedAll(anyList()))
        .willAnswer(
            invocation -> {
              List<TextSegment> segments = invocation.getArgument(0);
              return Response.from(
                  segments.stream().map(s -> embeddingModel.embed(s.text()).content()).toList());
            });
    var batchingService =
        new CorpusIngestionService(index, counting, VALIDATOR, new ObjectMapper());
    List<CorpusRecord> records = new ArrayList<>();
    IntStream.range(0, CorpusIngestionService.EMBED_BATCH_SIZE + 10)
        .forEach(
            i -> records.add(new CorpusRecord("Doc " + i, null, null, null, null, "Text " + i)));

    IngestionReport report = batchingService.ingestRecords(records);

    assertThat(report.passages()).isEqualTo(CorpusIngestionService.EMBED_BATCH_SIZE + 10);
    then(counting).should(times(2)).embedAll(anyList());
  }

  @Test
  void missingCorpusFileFails() {
    assertThatThrownBy(() -> service.ingest(tempDir.resolve("missing.jsonl")))
        .isInstanceOf(UncheckedIOException.class);
  }

  @Test
  void documentIdIsTruncatedSha256OfTitleAndText() {
    var record = new CorpusRecord("Penal Code", 1860, "act", "Section 302", null, "Murder.");

    assertThat(CorpusIngestionService.documentId(record))
        .isEqualTo("ec8dd195194e2334bdf993bed395ad19");
  }

  @Test
  void documentIdIsStableAndDependsOnTitleAndText() {
    var record = new CorpusRecord("Penal Code", 1860, "act", "Section 302", null, "Murder.");
    var retitled = new CorpusRecord("Other Code", 1860, "act", "Section 302", null, "Murder.");
    var untitled = new CorpusRecord(null, 1860, "act", "Section 302", null, "Murder.");

    assertThat(CorpusIngestionService.documentId(record))
        .hasSize(32)
        .isEqualTo(CorpusIngestionService.documentId(record))
        .isNotEqualTo(CorpusIngestionService.documentId(retitled))
        .isNotEqualTo(CorpusIngestionService.documentId(untitled));
  }

  @Test
  void passageIdAppendsOrdinalToDocumentId() {
    assertThat(CorpusIngestionService.passageId("abc", 3)).isEqualTo("abc-3");
  }
}
