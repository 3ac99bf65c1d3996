package dev.lexsearch.retrieval;

import dev.langchain4j.data.embedding.Embedding;
import dev.lexsearch.passage.Passage;
import dev.lexsearch.passage.PassageFilter;
import dev.lexsearch.passage.PassageRepository;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link PassageIndex} backed by the PostgreSQL {@code passages} table (pgvector + full-text).
 *
 * <p>Filtering, ranking and limiting happen in SQL (see {@link PassageRepository}). Each search
 * runs in its own read-only transaction whose {@code statement_timeout} is the retrieval timeout,
 * so a query abandoned by the caller is also cancelled server-side. Semantic searches widen the
 * HNSW candidate list to the requested limit and enable iterative index scans, so a selective
 * filter still yields up to {@code limit} rows instead of whatever survives the first {@code
 * ef_search} neighbours. Iterative scans need pgvector 0.8 or later.
 *
 * <p>Transient database errors are retried with exponential backoff; anything else propagates to
 * the caller.
 */
public class PostgresPassageIndex implements PassageIndex {

  private static final Logger log = LoggerFactory.getLogger(PostgresPassageIndex.class);

  /** pgvector's default {@code hnsw.ef_search}. */
  static final int DEFAULT_EF_SEARCH = 40;

  /** Upper bound pgvector accepts for {@code hnsw.ef_search}. */
  static final int MAX_EF_SEARCH = 1000;

  private static final Duration DEFAULT_STATEMENT_TIMEOUT = Duration.ofSeconds(5);

  private final PassageRepository repository;
  private final int dimension;
  private final Duration statementTimeout;

  public PostgresPassageIndex(
      PassageRepository repository, int dimension, Duration statementTimeout) {
    this.repository = repository;
    this.dimension = dimension;
    this.statementTimeout = statementTimeout;
  }

  public PostgresPassageIndex(PassageRepository repository, int dimension) {
    this(repository, dimension, DEFAULT_STATEMENT_TIMEOUT);
  }

  @Override
  @Retryable(
      retryFor = TransientDataAccessException.class,
      maxAttemptsExpression = "${lexsearch.store.retry.max-attempts:3}",
      backoff =
          @Backoff(
              delayExpression = "${lexsearch.store.retry.delay-ms:200}",
              multiplierExpression = "${lexsearch.store.retry.multiplier:2.0}"))
  @Transactional(readOnly = true)
  public List<LexicalHit> lexicalSearch(String queryText, PassageFilter filter, int limit) {
    if (queryText.isBlank() || limit <= 0) {
      return List.of();
    }
    repository.setLocal("statement_timeout", String.valueOf(statementTimeout.toMillis()));
    return repository
        .lexicalSearch(queryText, filter.year(), filter.category(), limit)
        .stream()
        .map(row -> new LexicalHit(toPassage(row), ((Number) row[9]).doubleValue()))
        .toList();
  }

  @Override
  @Retryable(
      retryFor = TransientDataAccessException.class,
      maxAttemptsExpression = "${lexsearch.store.retry.max-attempts:3}",
      backoff =
          @Backoff(
              delayExpression = "${lexsearch.store.retry.delay-ms:200}",
              multiplierExpression = "${lexsearch.store.retry.multiplier:2.0}"))
  @Transactional(readOnly = true)
  public List<SemanticHit> semanticSearch(
      Embedding queryEmbedding, PassageFilter filter, int limit) {
    requireDimension(queryEmbedding, "Query embedding");
    if (limit <= 0) {
      return List.of();
    }
    repository.setLocal("statement_timeout", String.valueOf(statementTimeout.toMillis()));
    repository.setLocal("hnsw.ef_search", String.valueOf(efSearch(limit)));
    // strict_order keeps results ordered by exact distance while the scan continues
    repository.setLocal("hnsw.iterative_scan", "strict_order");
    return repository
        .semanticSearch(toVectorLiteral(queryEmbedding), filter.year(), filter.category(), limit)
        .stream()
        .map(row -> new SemanticHit(toPassage(row), ((Number) row[9]).doubleValue()))
        .toList();
  }

  /**
   * Upserts the owning documents, then the passages, in one transaction. Document-level attributes
   * (title, year, category) are taken from the first passage of each document.
   */
  @Override
  @Transactional
  public void addAll(List<Passage> passages) {
    for (Passage passage : passages) {
      requireDimension(passage.embedding(), "Passage " + passage.id());
    }
    Map<String, Passage> firstPerDocument = new LinkedHashMap<>();
    for (Passage passage : passages) {
      firstPerDocument.putIfAbsent(passage.documentId(), passage);
    }
    firstPerDocument.forEach(
        (documentId, passage) ->
            repository.upsertDocument(
                documentId, passage.title(), passage.year(), passage.category(), null));
    for (Passage passage : passages) {
      repository.upsertPassage(
          passage.id(),
          passage.documentId(),
          passage.heading(),
          passage.text(),
          passage.parentText(),
          toVectorLiteral(passage.embedding()),
          passage.year(),
          passage.category(),
          passage.text().split("\\s+").length);
    }
    log.info(
        "Stored {} passages for {} documents in PostgreSQL",
        passages.size(),
        firstPerDocument.size());
  }

  @Override
  public long size() {
    return repository.count();
  }

  /** Candidate list size for an HNSW scan returning up to {@code limit} rows. */
  static int efSearch(int limit) {
    return Math.min(MAX_EF_SEARCH, Math.max(DEFAULT_EF_SEARCH, limit));
  }

  /**
   * Maps a {@code [id, doc_id, title, heading, text, parent_text, embedding, year, category, ...]}
   * search row to a passage.
   */
  static Passage toPassage(Object[] row) {
    return new Passage(
        (String) row[0],
        (String) row[1],
        (String) row[2],
        (String) row[3],
        (String) row[4],
        (String) row[5],
        parseVectorLiteral((String) row[6]),
        row[7] != null ? ((Number) row[7]).intValue() : null,
        (String) row[8]);
  }

  /** Formats an embedding in pgvector text form, e.g. {@code [0.1,0.2,0.3]}. */
  static String toVectorLiteral(Embedding embedding) {
    float[] vector = embedding.vector();
    StringBuilder literal = new StringBuilder(vector.length * 10 + 2).append('[');
    for (int i = 0; i < vector.length; i++) {
      if (i > 0) {
        literal.append(',');
      }
      literal.append(vector[i]);
    }
    return literal.append(']').toString();
  }

  /** Parses pgvector text form back into an embedding. */
  static Embedding parseVectorLiteral(@Nullable String literal) {
    if (literal == null || literal.length() < 2) {
      return Embedding.from(new float[0]);
    }
    String body = literal.substring(1, literal.length() - 1).trim();
    if (body.isEmpty()) {
      return Embedding.from(new float[0]);
    }
    String[] parts = body.split(",");
    float[] vector = new float[parts.length];
    for (int i = 0; i < parts.length; i++) {
      vector[i] = Float.parseFloat(parts[i].trim());
    }
    return Embedding.from(vector);
  }

  private void requireDimension(Embedding embedding, String owner) {
    if (embedding.dimension() != dimension) {
      throw new IllegalArgumentException(
          owner + " has dimension " + embedding.dimension() + ", index expects " + dimension);
    }
  }
}
