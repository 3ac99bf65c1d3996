package dev.lexsearch.search;

import dev.lexsearch.passage.PassageFilter;
import java.time.Duration;
import org.jspecify.annotations.Nullable;

/**
 * A search request: query text, metadata filter and the three shrinking candidate budgets.
 *
 * <p>Budgets must be non-negative; {@code alpha} and {@code lambda} overrides must lie in [0, 1].
 * Violations fail here, before any retrieval call. Budgets that are out of order ({@code topN >
 * mmrK} or {@code mmrK > preK}) are not rejected; {@link #clampedTo(int)} corrects them. A {@code
 * null} query is treated as blank, which yields an empty result.
 *
 * @param query the natural-language query text
 * @param filter exact-match metadata constraints ({@code null} means none)
 * @param preK initial candidate pool size per retrieval signal and after fusion
 * @param mmrK diversity-selection pool size
 * @param topN number of final results
 * @param minScore optional minimum reranker score; lower-scored results are dropped
 * @param alpha optional lexical fusion weight overriding {@code lexsearch.search.alpha}
 * @param lambda optional MMR relevance weight overriding {@code lexsearch.search.lambda}
 * @param timeout optional per-call timeout for retrieval and reranking, overriding {@code
 *     lexsearch.search.retrieval-timeout-ms} and {@code rerank-timeout-ms}; must be positive
 */
public record QuerySpec(
    String query,
    PassageFilter filter,
    int preK,
    int mmrK,
    int topN,
    @Nullable Double minScore,
    @Nullable Double alpha,
    @Nullable Double lambda,
    @Nullable Duration timeout) {

  public static final int DEFAULT_PRE_K = 200;
  public static final int DEFAULT_MMR_K = 20;
  public static final int DEFAULT_TOP_N = 10;

  /** Compact constructor validating input. */
  public QuerySpec {
    query = query == null ? "" : query;
    filter = filter == null ? PassageFilter.NONE : filter;
    if (preK < 0) {
      throw new IllegalArgumentException("preK must not be negative, got: " + preK);
    }
    if (mmrK < 0) {
      throw new IllegalArgumentException("mmrK must not be negative, got: " + mmrK);
    }
    if (topN < 0) {
      throw new IllegalArgumentException("topN must not be negative, got: " + topN);
    }
    if (minScore != null && minScore.isNaN()) {
      throw new IllegalArgumentException("minScore must be a number");
    }
    requireUnitInterval("alpha", alpha);
    requireUnitInterval("lambda", lambda);
    if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
      throw new IllegalArgumentException("timeout must be positive, got: " + timeout);
    }
  }

  /** Convenience constructor using the configured timeouts. */
  public QuerySpec(
      String query,
      PassageFilter filter,
      int preK,
      int mmrK,
      int topN,
      @Nullable Double minScore,
      @Nullable Double alpha,
      @Nullable Double lambda) {
    this(query, filter, preK, mmrK, topN, minScore, alpha, lambda, null);
  }

  /** Convenience constructor with default budgets and no filter. */
  public QuerySpec(String query) {
    this(query, PassageFilter.NONE);
  }

  /** Convenience constructor with default budgets. */
  public QuerySpec(String query, PassageFilter filter) {
    this(query, filter, DEFAULT_PRE_K, DEFAULT_MMR_K, DEFAULT_TOP_N, null, null, null);
  }

  /** Convenience constructor using the configured alpha and lambda. */
  public QuerySpec(
      String query,
      PassageFilter filter,
      int preK,
      int mmrK,
      int topN,
      @Nullable Double minScore) {
    this(query, filter, preK, mmrK, topN, minScore, null, null);
  }

  /**
   * Returns this spec with budgets satisfying {@code topN <= mmrK <= preK <= maxPreK}. Each budget
   * is lowered to the one before it; nothing is ever raised.
   *
   * @param maxPreK the deployment-wide cap on the initial candidate pool
   * @return a spec with ordered budgets ({@code this} if already ordered)
   */
  public QuerySpec clampedTo(int maxPreK) {
    int clampedPreK = Math.min(preK, maxPreK);
    int clampedMmrK = Math.min(mmrK, clampedPreK);
    int clampedTopN = Math.min(topN, clampedMmrK);
    if (clampedPreK == preK && clampedMmrK == mmrK && clampedTopN == topN) {
      return this;
    }
    return new QuerySpec(
        query, filter, clampedPreK, clampedMmrK, clampedTopN, minScore, alpha, lambda, timeout);
  }

  private static void requireUnitInterval(String name, @Nullable Double value) {
    if (value != null && !(value >= 0.0 && value <= 1.0)) {
      throw new IllegalArgumentException(name + " must be in [0.0, 1.0], got: " + value);
    }
  }
}
