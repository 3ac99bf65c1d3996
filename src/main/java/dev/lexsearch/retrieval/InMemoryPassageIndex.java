package dev.lexsearch.retrieval;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.store.embedding.CosineSimilarity;
import dev.lexsearch.passage.Passage;
import dev.lexsearch.passage.PassageFilter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.concurrent.ConcurrentSkipListMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link PassageIndex} held entirely in memory, for tests and deployments without PostgreSQL.
 *
 * <p>Lexical search ranks with {@link LexicalScorer}; semantic search is an exhaustive scan by
 * cosine distance ({@code 1 - cosine similarity}). Passages are kept sorted by id so that scans and
 * tie-breaking are deterministic. Safe for concurrent readers and writers.
 */
public class InMemoryPassageIndex implements PassageIndex {

  private static final Logger log = LoggerFactory.getLogger(InMemoryPassageIndex.class);

  private static final Comparator<LexicalHit> LEXICAL_ORDER =
      Comparator.comparingDouble(LexicalHit::score)
          .reversed()
          .thenComparing(hit -> hit.passage().id());

  private static final Comparator<SemanticHit> SEMANTIC_ORDER =
      Comparator.comparingDouble(SemanticHit::distance).thenComparing(hit -> hit.passage().id());

  private final int dimension;
  private final NavigableMap<String, IndexedPassage> passages = new ConcurrentSkipListMap<>();

  public InMemoryPassageIndex(int dimension) {
    if (dimension < 1) {
      throw new IllegalArgumentException("dimension must be at least 1, got: " + dimension);
    }
    this.dimension = dimension;
  }

  @Override
  public void addAll(List<Passage> batch) {
    for (Passage passage : batch) {
      requireDimension(passage.embedding(), "Passage " + passage.id());
    }
    for (Passage passage : batch) {
      passages.put(passage.id(), IndexedPassage.of(passage));
    }
    log.debug("Indexed {} passages in memory ({} total)", batch.size(), passages.size());
  }

  @Override
  public long size() {
    return passages.size();
  }

  @Override
  public List<LexicalHit> lexicalSearch(String queryText, PassageFilter filter, int limit) {
    Set<String> queryTerms = LexicalScorer.queryTerms(queryText);
    if (queryTerms.isEmpty() || limit <= 0) {
      return List.of();
    }
    List<LexicalHit> hits = new ArrayList<>();
    for (IndexedPassage indexed : passages.values()) {
      if (!filter.matches(indexed.passage())) {
        continue;
      }
      double score =
          LexicalScorer.score(
              queryTerms,
              indexed.headingFrequencies(),
              indexed.bodyFrequencies(),
              indexed.bodyLength());
      if (score > 0.0) {
        hits.add(new LexicalHit(indexed.passage(), score));
      }
    }
    return hits.stream().sorted(LEXICAL_ORDER).limit(limit).toList();
  }

  @Override
  public List<SemanticHit> semanticSearch(
      Embedding queryEmbedding, PassageFilter filter, int limit) {
    requireDimension(queryEmbedding, "Query embedding");
    if (limit <= 0) {
      return List.of();
    }
    List<SemanticHit> hits = new ArrayList<>();
    for (IndexedPassage indexed : passages.values()) {
      Passage passage = indexed.passage();
      if (filter.matches(passage)) {
        double distance = 1.0 - CosineSimilarity.between(queryEmbedding, passage.embedding());
        hits.add(new SemanticHit(passage, distance));
      }
    }
    return hits.stream().sorted(SEMANTIC_ORDER).limit(limit).toList();
  }

  private void requireDimension(Embedding embedding, String owner) {
    if (embedding.dimension() != dimension) {
      throw new IllegalArgumentException(
          owner + " has dimension " + embedding.dimension() + ", index expects " + dimension);
    }
  }

  /** Passage with its term statistics precomputed at indexing time. */
  private record IndexedPassage(
      Passage passage,
      Map<String, Integer> headingFrequencies,
      Map<String, Integer> bodyFrequencies,
      int bodyLength) {

    static IndexedPassage of(Passage passage) {
      List<String> bodyTerms = LexicalScorer.terms(passage.text());
      return new IndexedPassage(
          passage,
          LexicalScorer.termFrequencies(LexicalScorer.terms(passage.heading())),
          LexicalScorer.termFrequencies(bodyTerms),
          bodyTerms.size());
    }
  }
}
