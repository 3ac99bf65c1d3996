package dev.lexsearch.passage;

import java.util.List;
import org.jspecify.annotations.Nullable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

/**
 * Spring Data repository for the {@code passages} table.
 *
 * <p>Both search queries return rows of {@code [id, doc_id, title, heading, text, parent_text,
 * embedding (as text), year, category, score]}. A {@code null} year or category disables that
 * filter.
 */
public interface PassageRepository extends JpaRepository<PassageEntity, String> {

  /**
   * Ranks passages matching the query against the weighted {@code search_vector} (heading weighted
   * above body text). Only passages that match at least one query term are returned.
   *
   * @param query the raw query text, parsed with {@code websearch_to_tsquery}
   * @param year optional exact year filter
   * @param category optional exact category filter
   * @param limit maximum number of rows
   * @return rows ordered by {@code ts_rank} descending, then passage id
   */
  @Query(
      value =
          """
            SELECT p.id, p.doc_id, d.title, p.heading, p.text, p.parent_text,
                   CAST(p.embedding AS text), p.year, p.category,
                   ts_rank(p.search_vector, websearch_to_tsquery('english', :query)) AS score
            FROM passages p
            JOIN documents d ON d.id = p.doc_id
            WHERE p.search_vector @@ websearch_to_tsquery('english', :query)
              AND (CAST(:year AS integer) IS NULL OR p.year = CAST(:year AS integer))
              AND (CAST(:category AS text) IS NULL OR p.category = CAST(:category AS text))
            ORDER BY score DESC, p.id
            LIMIT :limit
            """,
      nativeQuery = true)
  List<Object[]> lexicalSearch(
      @Param("query") String query,
      @Param("year") @Nullable Integer year,
      @Param("category") @Nullable String category,
      @Param("limit") int limit);

  /**
   * Orders passages by cosine distance between their embedding and the query embedding.
   *
   * @param embedding the query embedding in pgvector text form ({@code [0.1,0.2,...]})
   * @param year optional exact year filter
   * @param category optional exact category filter
   * @param limit maximum number of rows
   * @return rows ordered by distance ascending, then passage id
   */
  @Query(
      value =
          """
            SELECT p.id, p.doc_id, d.title, p.heading, p.text, p.parent_text,
                   CAST(p.embedding AS text), p.year, p.category,
                   (p.embedding <=> CAST(:embedding AS vector)) AS distance
            FROM passages p
            JOIN documents d ON d.id = p.doc_id
            WHERE (CAST(:year AS integer) IS NULL OR p.year = CAST(:year AS integer))
              AND (CAST(:category AS text) IS NULL OR p.category = CAST(:category AS text))
            ORDER BY distance, p.id
            LIMIT :limit
            """,
      nativeQuery = true)
  List<Object[]> semanticSearch(
      @Param("embedding") String embedding,
      @Param("year") @Nullable Integer year,
      @Param("category") @Nullable String category,
      @Param("limit") int limit);

  /**
   * Sets a configuration parameter for the rest of the current transaction, like {@code SET
   * LOCAL}. Outside a transaction the setting only lasts for this statement.
   *
   * @return the new value
   */
  @Query(value = "SELECT set_config(:name, :value, true)", nativeQuery = true)
  String setLocal(@Param("name") String name, @Param("value") String value);

  /** Inserts or replaces the owning document row of a passage. */
  @Modifying
  @Transactional
  @Query(
      value =
          """
            INSERT INTO documents (id, title, year, category, source)
            VALUES (:id, :title, :year, :category, :source)
            ON CONFLICT (id) DO UPDATE
            SET title = EXCLUDED.title, year = EXCLUDED.year,
                category = EXCLUDED.category, source = EXCLUDED.source
            """,
      nativeQuery = true)
  void upsertDocument(
      @Param("id") String id,
      @Param("title") @Nullable String title,
      @Param("year") @Nullable Integer year,
      @Param("category") @Nullable String category,
      @Param("source") @Nullable String source);

  /** Inserts or replaces a passage together with its embedding. */
  @Modifying
  @Transactional
  @Query(
      value =
          """
            INSERT INTO passages
                (id, doc_id, heading, text, parent_text, embedding, year, category, token_count)
            VALUES (:id, :documentId, :heading, :text, :parentText, CAST(:embedding AS vector),
                    :year, :category, :tokenCount)
            ON CONFLICT (id) DO UPDATE
            SET doc_id = EXCLUDED.doc_id, heading = EXCLUDED.heading, text = EXCLUDED.text,
                parent_text = EXCLUDED.parent_text, embedding = EXCLUDED.embedding,
                year = EXCLUDED.year, category = EXCLUDED.category,
                token_count = EXCLUDED.token_count
            """,
      nativeQuery = true)
  void upsertPassage(
      @Param("id") String id,
      @Param("documentId") String documentId,
      @Param("heading") @Nullable String heading,
      @Param("text") String text,
      @Param("parentText") @Nullable String parentText,
      @Param("embedding") String embedding,
      @Param("year") @Nullable Integer year,
      @Param("category") @Nullable String category,
      @Param("tokenCount") int tokenCount);
}
