package dev.lexsearch.search;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.lexsearch.passage.PassageFilter;
import dev.lexsearch.retrieval.CandidateSource;
import dev.lexsearch.retrieval.LexicalHit;
import dev.lexsearch.retrieval.SemanticHit;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Search orchestration layer implementing the hybrid retrieval pipeline: concurrent lexical and
 * semantic retrieval, score fusion, diversity selection and cross-encoder reranking.
 *
 * <p>Pipeline: clamp budgets -> run lexical search and (embed query, semantic search) concurrently
 * with {@code preK} candidates each -> fuse standardised scores with Convex Combination, keep
 * {@code preK} -> MMR selection of {@code mmrK} -> rerank, threshold and keep {@code topN}.
 *
 * <p>Failures are explicit: a failing or timed-out retrieval call raises {@link
 * RetrievalException}, an unusable reranker raises {@link RerankerUnavailableException} unless a
 * fallback reranker is configured. No matches is an empty list, never an error.
 */
@Service
public class SearchService {

  private static final Logger log = LoggerFactory.getLogger(SearchService.class);

  private final CandidateSource candidateSource;
  private final EmbeddingModel embeddingModel;
  private final RerankerService rerankerService;
  private final SearchProperties searchProperties;
  private final Executor searchExecutor;

  public SearchService(
      CandidateSource candidateSource,
      EmbeddingModel embeddingModel,
      RerankerService rerankerService,
      SearchProperties searchProperties,
      @Qualifier("searchExecutor") Executor searchExecutor) {
    this.candidateSource = candidateSource;
    this.embeddingModel = embeddingModel;
    this.rerankerService = rerankerService;
    this.searchProperties = searchProperties;
    this.searchExecutor = searchExecutor;
  }

  /**
   * Convenience overload building a {@link QuerySpec} from positional arguments.
   *
   * @throws IllegalArgumentException if a budget is negative
   */
  public List<RankedResult> search(
      String query,
      PassageFilter filter,
      int preK,
      int mmrK,
      int topN,
      @Nullable Double minScore) {
    return search(new QuerySpec(query, filter, preK, mmrK, topN, minScore));
  }

  /**
   * Runs the full pipeline for one query.
   *
   * @param spec the validated query; budgets are clamped to {@code topN <= mmrK <= preK <=
   *     max-pre-k}
   * @return at most {@code topN} results ordered by reranker score descending; empty for a blank
   *     query or when nothing matches
   * @throws RetrievalException if a retrieval call fails or times out
   * @throws RerankerUnavailableException if the reranker fails and no fallback is configured
   */
  public List<RankedResult> search(QuerySpec spec) {
    QuerySpec clamped = spec.clampedTo(searchProperties.getMaxPreK());
    if (clamped != spec) {
      log.debug(
          "Clamped budgets preK={} mmrK={} topN={} to preK={} mmrK={} topN={}",
          spec.preK(),
          spec.mmrK(),
          spec.topN(),
          clamped.preK(),
          clamped.mmrK(),
          clamped.topN());
    }
    if (clamped.query().isBlank() || clamped.topN() == 0) {
      return List.of();
    }

    long started = System.nanoTime();
    Candidates candidates =
        retrieve(
            clamped,
            Objects.requireNonNullElse(
                clamped.timeout(),
                Duration.ofMillis(searchProperties.getRetrievalTimeoutMs())));
    if (candidates.lexical().isEmpty() && candidates.semantic().isEmpty()) {
      log.debug("No candidates for query '{}' with filter {}", clamped.query(), clamped.filter());
      return List.of();
    }

    double alpha = Objects.requireNonNullElse(clamped.alpha(), searchProperties.getAlpha());
    double lambda = Objects.requireNonNullElse(clamped.lambda(), searchProperties.getLambda());

    List<ScoredCandidate> fused =
        ConvexCombinationFusion.fuse(
            candidates.lexical(), candidates.semantic(), alpha, clamped.preK());
    List<ScoredCandidate> diverse = DiversitySelector.select(fused, clamped.mmrK(), lambda);
    List<RankedResult> results =
        rerankerService.rerank(
            clamped.query(), diverse, clamped.topN(), clamped.minScore(), clamped.timeout());

    log.info(
        "Search: filtered={} lexical={} semantic={} fused={} diverse={} results={} in {} ms",
        !clamped.filter().isEmpty(),
        candidates.lexical().size(),
        candidates.semantic().size(),
        fused.size(),
        diverse.size(),
        results.size(),
        TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
    return results;
  }

  /**
   * Runs both retrieval calls concurrently under one shared deadline. When either fails or the
   * deadline passes, both calls are cancelled and their worker threads interrupted.
   */
  private Candidates retrieve(QuerySpec spec, Duration timeout) {
    PassageFilter filter = spec.filter();
    int limit = spec.preK();

    FutureTask<List<LexicalHit>> lexical =
        new FutureTask<>(() -> candidateSource.lexicalSearch(spec.query(), filter, limit));
    FutureTask<List<SemanticHit>> semantic =
        new FutureTask<>(
            () -> {
              Embedding queryEmbedding =
                  embeddingModel.embed(searchProperties.getQueryPrefix() + spec.query()).content();
              return candidateSource.semanticSearch(queryEmbedding, filter, limit);
            });

    long deadline = System.nanoTime() + timeout.toNanos();
    try {
      submit(lexical, RetrievalException.Signal.LEXICAL);
      submit(semantic, RetrievalException.Signal.SEMANTIC);
      List<LexicalHit> lexicalHits =
          await(lexical, RetrievalException.Signal.LEXICAL, deadline, timeout);
      List<SemanticHit> semanticHits =
          await(semantic, RetrievalException.Signal.SEMANTIC, deadline, timeout);
      return new Candidates(lexicalHits, semanticHits);
    } catch (RetrievalException e) {
      lexical.cancel(true);
      semantic.cancel(true);
      log.warn("{} retrieval failed: {}", e.getSignal(), e.getMessage());
      throw e;
    }
  }

  private void submit(FutureTask<?> task, RetrievalException.Signal signal) {
    try {
      searchExecutor.execute(task);
    } catch (RejectedExecutionException e) {
      throw new RetrievalException(signal, signal + " retrieval was rejected by the executor", e);
    }
  }

  private static <T> List<T> await(
      Future<List<T>> future,
      RetrievalException.Signal signal,
      long deadline,
      Duration timeout) {
    long remaining = Math.max(0L, deadline - System.nanoTime());
    try {
      List<T> hits = future.get(remaining, TimeUnit.NANOSECONDS);
      return hits == null ? List.of() : hits;
    } catch (TimeoutException e) {
      throw new RetrievalException(
          signal, signal + " retrieval timed out after " + timeout.toMillis() + " ms", e);
    } catch (ExecutionException e) {
      Throwable cause = Objects.requireNonNullElse(e.getCause(), e);
      throw new RetrievalException(
          signal, signal + " retrieval failed: " + cause.getMessage(), cause);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RetrievalException(signal, "Interrupted during " + signal + " retrieval", e);
    }
  }

  private record Candidates(List<LexicalHit> lexical, List<SemanticHit> semantic) {}
}
