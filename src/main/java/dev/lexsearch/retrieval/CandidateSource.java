package dev.lexsearch.retrieval;

import dev.langchain4j.data.embedding.Embedding;
import dev.lexsearch.passage.PassageFilter;
import java.util.List;

/**
 * The two retrieval primitives the search pipeline consumes from the passage store.
 *
 * <p>Implementations apply the exact-match {@link PassageFilter} themselves, return at most {@code
 * limit} hits and order them by their native score: lexical hits by score descending, semantic
 * hits by distance ascending, ties by passage id. Failures are thrown, never replaced by an empty
 * list: an empty list means "no matches".
 */
public interface CandidateSource {

  /**
   * Full-text search over passage heading and body.
   *
   * @param queryText the raw query text
   * @param filter metadata constraints every hit must satisfy
   * @param limit maximum number of hits
   * @return hits ordered by lexical score descending
   */
  List<LexicalHit> lexicalSearch(String queryText, PassageFilter filter, int limit);

  /**
   * Nearest-neighbour search by cosine distance to the query embedding.
   *
   * @param queryEmbedding the embedded query, of the system-wide dimension
   * @param filter metadata constraints every hit must satisfy
   * @param limit maximum number of hits
   * @return hits ordered by distance ascending
   */
  List<SemanticHit> semanticSearch(Embedding queryEmbedding, PassageFilter filter, int limit);
}
