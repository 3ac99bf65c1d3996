package dev.lexsearch.search;

import dev.lexsearch.passage.Passage;
import java.util.Comparator;

/**
 * A {@link Candidate} after normalisation and fusion. Input to {@link DiversitySelector}.
 *
 * @param candidate the candidate with its raw scores
 * @param lexicalNorm standardised lexical score (0.0 when the lexical signal is missing)
 * @param semanticNorm standardised semantic score (0.0 when the semantic signal is missing)
 * @param fusedScore {@code alpha * lexicalNorm + (1 - alpha) * semanticNorm}
 */
public record ScoredCandidate(
    Candidate candidate, double lexicalNorm, double semanticNorm, double fusedScore) {

  /** Fused score descending, then passage id ascending. */
  public static final Comparator<ScoredCandidate> FUSED_ORDER =
      Comparator.comparingDouble(ScoredCandidate::fusedScore)
          .reversed()
          .thenComparing(ScoredCandidate::id);

  public String id() {
    return candidate.id();
  }

  public Passage passage() {
    return candidate.passage();
  }
}
