package dev.lexsearch.search;

import dev.lexsearch.passage.Passage;
import org.jspecify.annotations.Nullable;

/**
 * A passage together with the raw signal scores attached to it during retrieval. Lives only for the
 * duration of one search.
 *
 * @param passage the retrieved passage
 * @param lexicalScore raw lexical rank, or {@code null} if lexical search did not return it
 * @param distance raw cosine distance, or {@code null} if semantic search did not return it
 */
public record Candidate(
    Passage passage, @Nullable Double lexicalScore, @Nullable Double distance) {

  public String id() {
    return passage.id();
  }
}
