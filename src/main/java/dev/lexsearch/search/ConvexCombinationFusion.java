package dev.lexsearch.search;

import dev.lexsearch.passage.Passage;
import dev.lexsearch.retrieval.LexicalHit;
import dev.lexsearch.retrieval.SemanticHit;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;

/**
 * Pure static utility for fusing lexical and semantic search results using Convex Combination.
 *
 * <p>Standardises each source's scores independently with {@link ScoreNormalizer}, then combines
 * them: {@code fused = alpha * lexicalNorm + (1 - alpha) * semanticNorm}. Semantic scores enter
 * as negated distances so that larger is better on both sides.
 *
 * <p>This class has no Spring dependencies and no state -- all methods are pure functions.
 */
public final class ConvexCombinationFusion {

  private ConvexCombinationFusion() {}

  /**
   * Fuses lexical and semantic hits into one deduplicated ranking.
   *
   * <p>Algorithm:
   *
   * <ol>
   *   <li>Drop repeated passage ids within each list (first occurrence wins)
   *   <li>Standardise lexical scores and negated semantic distances separately
   *   <li>Merge by passage id; a passage found by only one search gets 0.0 (the list average) for
   *       the missing signal, not the worst possible score
   *   <li>Sort by fused score descending, passage id ascending; limit to maxResults
   * </ol>
   *
   * @param lexicalHits candidates from full-text search
   * @param semanticHits candidates from embedding search
   * @param alpha weight for lexical scores (0.0 = semantic only, 1.0 = lexical only)
   * @param maxResults maximum number of fused candidates to return (the initial-pool budget)
   * @return fused candidates, best first
   */
  static List<ScoredCandidate> fuse(
      List<LexicalHit> lexicalHits, List<SemanticHit> semanticHits, double alpha, int maxResults) {
    if (lexicalHits.isEmpty() && semanticHits.isEmpty()) {
      return List.of();
    }

    List<LexicalHit> lexical = distinctByPassage(lexicalHits, LexicalHit::passage);
    List<SemanticHit> semantic = distinctByPassage(semanticHits, SemanticHit::passage);

    double[] lexicalNorm =
        ScoreNormalizer.standardize(lexical.stream().mapToDouble(LexicalHit::score).toArray());
    double[] semanticNorm =
        ScoreNormalizer.standardize(semantic.stream().mapToDouble(h -> -h.distance()).toArray());

    // Insertion order is irrelevant to the result: the final sort is total.
    Map<String, FusedEntry> fusedMap = new LinkedHashMap<>();

    for (int i = 0; i < lexical.size(); i++) {
      LexicalHit hit = lexical.get(i);
      fusedMap.put(
          hit.passage().id(),
          new FusedEntry(hit.passage(), hit.score(), null, lexicalNorm[i], 0.0));
    }

    for (int i = 0; i < semantic.size(); i++) {
      SemanticHit hit = semantic.get(i);
      FusedEntry existing = fusedMap.get(hit.passage().id());
      if (existing != null) {
        fusedMap.put(hit.passage().id(), existing.withSemantic(hit.distance(), semanticNorm[i]));
      } else {
        fusedMap.put(
            hit.passage().id(),
            new FusedEntry(hit.passage(), null, hit.distance(), 0.0, semanticNorm[i]));
      }
    }

    return fusedMap.values().stream()
        .map(entry -> entry.toScoredCandidate(alpha))
        .sorted(ScoredCandidate.FUSED_ORDER)
        .limit(maxResults)
        .toList();
  }

  private static <T> List<T> distinctByPassage(List<T> hits, Function<T, Passage> passageOf) {
    Set<String> seen = new LinkedHashSet<>();
    return hits.stream().filter(hit -> seen.add(passageOf.apply(hit).id())).toList();
  }

  /** Internal holder for a passage while its signals are being merged. */
  private record FusedEntry(
      Passage passage,
      @Nullable Double lexicalScore,
      @Nullable Double distance,
      double lexicalNorm,
      double semanticNorm) {

    FusedEntry withSemantic(double distance, double semanticNorm) {
      return new FusedEntry(passage, lexicalScore, distance, lexicalNorm, semanticNorm);
    }

    ScoredCandidate toScoredCandidate(double alpha) {
      double fused = alpha * lexicalNorm + (1.0 - alpha) * semanticNorm;
      return new ScoredCandidate(
          new Candidate(passage, lexicalScore, distance), lexicalNorm, semanticNorm, fused);
    }
  }
}
