package dev.lexsearch.search;

import static org.assertj.core.api.Assertions.assertThat;

import dev.lexsearch.BaseIntegrationTest;
import dev.lexsearch.ingestion.CorpusIngestionService;
import dev.lexsearch.ingestion.CorpusRecord;
import dev.lexsearch.passage.PassageFilter;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class SearchPipelineIT extends BaseIntegrationTest {

  @Autowired SearchService searchService;

  @Autowired CorpusIngestionService ingestionService;

  @BeforeEach
  void seedCorpus() {
    ingestionService.ingestRecords(
        List.of(
            new CorpusRecord(
                "Penal Code",
                1860,
                "act",
                "Punishment for murder",
                "302",
                "Whoever commits murder shall be punished with death or imprisonment for life."),
            new CorpusRecord(
                "Penal Code",
                1860,
                "act",
                "Punishment for theft",
                "379",
                "Whoever commits theft shall be punished with imprisonment up to three years."),
            new CorpusRecord(
                "Constitution",
                1950,
                "constitution",
                "Right to property",
                "300A",
                "No person shall be deprived of his property save by authority of law."),
            new CorpusRecord(
                "Contract Act",
                1872,
                "act",
                "Free consent",
                "14",
                "Consent is said to be free when it is not caused by coercion or fraud.")));
  }

  @Test
  void exactTermQueryRanksMatchingSectionFirst() {
    List<RankedResult> results = searchService.search(new QuerySpec("punishment for murder"));

    assertThat(results).isNotEmpty();
    RankedResult top = results.get(0);
    assertThat(top.heading()).isEqualTo("Punishment for murder");
    assertThat(top.lexicalScore()).isNotNull();
    assertThat(top.distance()).isNotNull();
  }

  @Test
  void resultsAreOrderedByRerankScore() {
    List<RankedResult> results = searchService.search(new QuerySpec("shall be punished"));

    assertThat(results)
        .extracting(RankedResult::rerankScore)
        .isSortedAccordingTo((a, b) -> Double.compare(b, a));
  }

  @Test
  void filterRestrictsCandidates() {
    List<RankedResult> results =
        searchService.search(new QuerySpec("property", PassageFilter.byCategory("constitution")));

    assertThat(results)
        .isNotEmpty()
        .allSatisfy(result -> assertThat(result.category()).isEqualTo("constitution"));
  }

  @Test
  void filterWithoutMatchesReturnsEmpty() {
    assertThat(searchService.search(new QuerySpec("murder", PassageFilter.byYear(2024))))
        .isEmpty();
  }

  @Test
  void topNLimitsResults() {
    List<RankedResult> results =
        searchService.search(new QuerySpec("law", PassageFilter.NONE, 50, 3, 2, null));

    assertThat(results).hasSizeLessThanOrEqualTo(2);
  }

  @Test
  void blankQueryReturnsEmpty() {
    assertThat(searchService.search(new QuerySpec("   "))).isEmpty();
  }

  @Test
  void repeatedSearchIsDeterministic() {
    QuerySpec spec = new QuerySpec("imprisonment");

    assertThat(searchService.search(spec)).isEqualTo(searchService.search(spec));
  }
}
