package dev.lexsearch.search;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.scoring.ScoringModel;
import dev.lexsearch.passage.Passage;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.IntStream;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pairwise reranking of diversity-selected candidates with a {@link ScoringModel} (an ONNX
 * cross-encoder, or the token-overlap scorer in degraded deployments).
 *
 * <p>Each candidate is scored as a (query, title + heading + text) pair. Results are ordered by
 * reranker score descending (ties: fused score, then passage id), filtered by the optional minimum
 * score and limited to the requested count.
 *
 * <p>The model runs on the executor under a timeout; a timed-out invocation is interrupted so that
 * it releases its worker thread. When the model fails, times out or returns a malformed response,
 * the configured fallback model scores the candidates instead, on the calling thread so that it
 * never queues behind stuck invocations. Without a fallback a {@link
 * RerankerUnavailableException} is thrown. Which of the two happens is decided by deployment
 * configuration, never per request.
 *
 * @see dev.langchain4j.model.scoring.ScoringModel
 */
public class RerankerService {

  private static final Logger log = LoggerFactory.getLogger(RerankerService.class);

  static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

  private static final Comparator<RankedResult> RANK_ORDER =
      Comparator.comparingDouble(RankedResult::rerankScore)
          .reversed()
          .thenComparing(Comparator.comparingDouble(RankedResult::fusedScore).reversed())
          .thenComparing(RankedResult::passageId);

  private final ScoringModel scoringModel;
  private final @Nullable ScoringModel fallbackModel;
  private final Executor executor;
  private final Duration timeout;
  private final boolean sigmoid;

  public RerankerService(
      ScoringModel scoringModel,
      @Nullable ScoringModel fallbackModel,
      Executor executor,
      Duration timeout,
      boolean sigmoid) {
    this.scoringModel = scoringModel;
    this.fallbackModel = fallbackModel;
    this.executor = executor;
    this.timeout = timeout;
    this.sigmoid = sigmoid;
  }

  /** Reranker without fallback or calibration, invoking the model on the calling thread. */
  public RerankerService(ScoringModel scoringModel) {
    this(scoringModel, null, Runnable::run, DEFAULT_TIMEOUT, false);
  }

  /**
   * Reranks candidates using the pairwise scoring model.
   *
   * @param query the original search query text
   * @param candidates diversity-selected candidates to rerank
   * @param maxResults maximum number of results to return after reranking
   * @param minScore minimum reranker score (nullable; null means no threshold)
   * @return results sorted by reranker score descending, limited to maxResults
   * @throws RerankerUnavailableException if the model cannot score and no fallback is configured
   */
  public List<RankedResult> rerank(
      String query,
      List<ScoredCandidate> candidates,
      int maxResults,
      @Nullable Double minScore) {
    return rerank(query, candidates, maxResults, minScore, null);
  }

  /**
   * Reranks candidates, bounding the model invocation by {@code callTimeout} instead of the
   * configured timeout when it is given.
   *
   * @param callTimeout per-request timeout for the model invocation (nullable)
   * @see #rerank(String, List, int, Double)
   */
  public List<RankedResult> rerank(
      String query,
      List<ScoredCandidate> candidates,
      int maxResults,
      @Nullable Double minScore,
      @Nullable Duration callTimeout) {
    if (candidates.isEmpty() || maxResults <= 0) {
      return List.of();
    }

    List<TextSegment> segments =
        candidates.stream().map(c -> TextSegment.from(rerankText(c.passage()))).toList();

    boolean calibrate = sigmoid;
    List<Double> scores;
    try {
      scores = score(query, segments, Objects.requireNonNullElse(callTimeout, timeout));
    } catch (RerankerUnavailableException e) {
      if (fallbackModel == null) {
        throw e;
      }
      log.warn(
          "Reranker unavailable ({}); scoring {} candidates with fallback reranker",
          e.getMessage(),
          candidates.size());
      scores = scoreInline(fallbackModel, query, segments);
      calibrate = false;
    }

    boolean applySigmoid = calibrate;
    List<Double> rawScores = scores;
    return IntStream.range(0, candidates.size())
        .mapToObj(
            i -> {
              double raw = rawScores.get(i);
              return RankedResult.of(candidates.get(i), raw, applySigmoid ? sigmoid(raw) : raw);
            })
        .filter(r -> minScore == null || r.rerankScore() >= minScore)
        .sorted(RANK_ORDER)
        .limit(maxResults)
        .toList();
  }

  private List<Double> score(String query, List<TextSegment> segments, Duration limit) {
    FutureTask<Response<List<Double>>> task =
        new FutureTask<>(() -> scoringModel.scoreAll(segments, query));
    Response<List<Double>> response;
    try {
      executor.execute(task);
      response = task.get(limit.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      task.cancel(true);
      throw new RerankerUnavailableException(
          "Reranker timed out after " + limit.toMillis() + " ms", e);
    } catch (ExecutionException e) {
      Throwable cause = Objects.requireNonNullElse(e.getCause(), e);
      throw new RerankerUnavailableException(
          "Reranker invocation failed: " + cause.getMessage(), cause);
    } catch (InterruptedException e) {
      task.cancel(true);
      Thread.currentThread().interrupt();
      throw new RerankerUnavailableException("Interrupted while reranking", e);
    } catch (RejectedExecutionException e) {
      throw new RerankerUnavailableException("Reranker executor rejected the invocation", e);
    }
    return requireScores(response, segments.size());
  }

  private static List<Double> scoreInline(
      ScoringModel model, String query, List<TextSegment> segments) {
    Response<List<Double>> response;
    try {
      response = model.scoreAll(segments, query);
    } catch (RuntimeException e) {
      throw new RerankerUnavailableException(
          "Fallback reranker failed: " + e.getMessage(), e);
    }
    return requireScores(response, segments.size());
  }

  private static List<Double> requireScores(
      @Nullable Response<List<Double>> response, int expected) {
    List<Double> scores = response == null ? null : response.content();
    if (scores == null || scores.size() != expected) {
      throw new RerankerUnavailableException(
          "Reranker returned "
              + (scores == null ? "no" : String.valueOf(scores.size()))
              + " scores for "
              + expected
              + " candidates");
    }
    return scores;
  }

  /** Title, heading and passage text separated by blank lines; missing parts are empty. */
  static String rerankText(Passage passage) {
    return String.join(
            "\n\n",
            Objects.requireNonNullElse(passage.title(), ""),
            Objects.requireNonNullElse(passage.heading(), ""),
            passage.text())
        .strip();
  }

  static double sigmoid(double logit) {
    return 1.0 / (1.0 + Math.exp(-logit));
  }
}
