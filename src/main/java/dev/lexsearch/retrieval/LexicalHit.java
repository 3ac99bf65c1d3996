package dev.lexsearch.retrieval;

import dev.lexsearch.passage.Passage;

/**
 * A passage matched by full-text search.
 *
 * @param passage the matched passage
 * @param score raw lexical rank (higher is better, scale is store-defined)
 */
public record LexicalHit(Passage passage, double score) {}
