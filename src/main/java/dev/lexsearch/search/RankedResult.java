package dev.lexsearch.search;

import dev.lexsearch.passage.Passage;
import org.jspecify.annotations.Nullable;

/**
 * Final search result. All intermediate signal scores are kept alongside the reranker score so
 * that rankings can be inspected and debugged.
 *
 * @param passageId the passage identifier
 * @param documentId the owning document identifier
 * @param title title of the owning document
 * @param heading section heading of the passage
 * @param text the matched passage text
 * @param contextText the parent context text, or {@code text} when the passage has none
 * @param year denormalized filter attribute
 * @param category denormalized filter attribute
 * @param lexicalScore raw lexical rank ({@code null} if not found by lexical search)
 * @param distance raw cosine distance ({@code null} if not found by semantic search)
 * @param lexicalNorm standardised lexical score
 * @param semanticNorm standardised semantic score
 * @param fusedScore convex combination of the two standardised scores
 * @param rawRerankScore score as returned by the reranking model
 * @param rerankScore reranker score after optional calibration; results are ordered by it
 */
public record RankedResult(
    String passageId,
    String documentId,
    @Nullable String title,
    @Nullable String heading,
    String text,
    String contextText,
    @Nullable Integer year,
    @Nullable String category,
    @Nullable Double lexicalScore,
    @Nullable Double distance,
    double lexicalNorm,
    double semanticNorm,
    double fusedScore,
    double rawRerankScore,
    double rerankScore) {

  static RankedResult of(ScoredCandidate scored, double rawRerankScore, double rerankScore) {
    Passage passage = scored.passage();
    return new RankedResult(
        passage.id(),
        passage.documentId(),
        passage.title(),
        passage.heading(),
        passage.text(),
        passage.contextText(),
        passage.year(),
        passage.category(),
        scored.candidate().lexicalScore(),
        scored.candidate().distance(),
        scored.lexicalNorm(),
        scored.semanticNorm(),
        scored.fusedScore(),
        rawRerankScore,
        rerankScore);
  }
}
