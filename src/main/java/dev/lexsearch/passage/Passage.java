package dev.lexsearch.passage;

import dev.langchain4j.data.embedding.Embedding;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A single retrievable unit of text from an indexed document.
 *
 * <p>{@code text} is what lexical and semantic search match against. {@code parentText} is the
 * surrounding context (typically the full section or document) handed to downstream consumers;
 * when absent, {@link #contextText()} falls back to {@code text}. The embedding dimensionality is
 * fixed system-wide ({@code lexsearch.models.embedding.dimension}).
 *
 * @param id unique passage identifier, used for deduplication and deterministic tie-breaking
 * @param documentId identifier of the owning document
 * @param title title of the owning document
 * @param heading optional section or heading label
 * @param text the searchable passage text
 * @param parentText optional surrounding context, distinct from {@code text}
 * @param embedding the passage embedding vector
 * @param year denormalized filter attribute
 * @param category denormalized filter attribute
 */
public record Passage(
    String id,
    String documentId,
    @Nullable String title,
    @Nullable String heading,
    String text,
    @Nullable String parentText,
    Embedding embedding,
    @Nullable Integer year,
    @Nullable String category) {

  public Passage {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(documentId, "documentId");
    Objects.requireNonNull(text, "text");
    if (text.isBlank()) {
      throw new IllegalArgumentException("Passage " + id + " has blank text");
    }
    Objects.requireNonNull(embedding, "embedding");
  }

  /** Returns the parent context text, or the passage text when no parent text is stored. */
  public String contextText() {
    return parentText == null || parentText.isEmpty() ? text : parentText;
  }

  public int dimension() {
    return embedding.dimension();
  }
}
