package dev.lexsearch.search;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.store.embedding.CosineSimilarity;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Maximal Marginal Relevance (MMR) selection over a fused ranking.
 *
 * <p>Greedy: the best fused candidate is taken first; every following pick maximises {@code lambda
 * * fusedScore - (1 - lambda) * maxSimilarityToSelected}, where similarity is the cosine
 * similarity of passage embeddings. Ties resolve to the higher fused score, then the lower passage
 * id. Cost is O(pool size x selection size) similarity computations; the pool is already bounded by
 * the fusion budget.
 */
public final class DiversitySelector {

  private DiversitySelector() {}

  /**
   * Selects up to {@code maxSelected} candidates balancing relevance against redundancy.
   *
   * @param ranked fused candidates (any order; re-sorted by {@link ScoredCandidate#FUSED_ORDER})
   * @param maxSelected the diversity-pool budget
   * @param lambda relevance weight in [0, 1]; 1.0 reduces to plain top-k by fused score
   * @return selected candidates in selection order; all candidates in fused order when the budget
   *     is not smaller than the input
   */
  static List<ScoredCandidate> select(
      List<ScoredCandidate> ranked, int maxSelected, double lambda) {
    if (maxSelected <= 0 || ranked.isEmpty()) {
      return List.of();
    }
    List<ScoredCandidate> pool = ranked.stream().sorted(ScoredCandidate.FUSED_ORDER).toList();
    if (maxSelected >= pool.size()) {
      return pool;
    }

    int size = pool.size();
    boolean[] taken = new boolean[size];
    double[] maxSimilarity = new double[size];
    Arrays.fill(maxSimilarity, Double.NEGATIVE_INFINITY);
    List<ScoredCandidate> selected = new ArrayList<>(maxSelected);

    int pick = 0;
    while (true) {
      taken[pick] = true;
      ScoredCandidate chosen = pool.get(pick);
      selected.add(chosen);
      if (selected.size() == maxSelected) {
        return selected;
      }

      int best = -1;
      double bestScore = Double.NEGATIVE_INFINITY;
      for (int i = 0; i < size; i++) {
        if (taken[i]) {
          continue;
        }
        ScoredCandidate candidate = pool.get(i);
        maxSimilarity[i] =
            Math.max(
                maxSimilarity[i],
                similarity(candidate.passage().embedding(), chosen.passage().embedding()));
        double adjusted = lambda * candidate.fusedScore() - (1.0 - lambda) * maxSimilarity[i];
        // Strict comparison over the fused order keeps the earlier candidate on ties.
        if (best < 0 || adjusted > bestScore) {
          best = i;
          bestScore = adjusted;
        }
      }
      pick = best;
    }
  }

  /** Cosine similarity; 0.0 for empty or mismatched vectors and for NaN results. */
  static double similarity(Embedding a, Embedding b) {
    if (a.dimension() == 0 || a.dimension() != b.dimension()) {
      return 0.0;
    }
    double similarity = CosineSimilarity.between(a, b);
    return Double.isNaN(similarity) ? 0.0 : similarity;
  }
}
