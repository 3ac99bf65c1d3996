package dev.lexsearch.retrieval;

import dev.lexsearch.passage.Passage;

/**
 * A passage matched by embedding similarity.
 *
 * @param passage the matched passage
 * @param distance raw cosine distance to the query embedding (lower is better)
 */
public record SemanticHit(Passage passage, double distance) {}
