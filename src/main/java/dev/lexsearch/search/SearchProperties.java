package dev.lexsearch.search;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the search pipeline.
 *
 * <p>Properties are bound from {@code lexsearch.search.*} in application.yml /
 * application.properties.
 *
 * <ul>
 *   <li>{@code alpha} - weight for lexical scores in convex combination fusion (0.0 = semantic
 *       only, 1.0 = lexical only; default 0.5)
 *   <li>{@code lambda} - MMR relevance weight (1.0 = no diversity penalty; default 0.7)
 *   <li>{@code max-pre-k} - hard cap on the initial candidate pool of any request (default 500)
 *   <li>{@code retrieval-timeout-ms} - shared deadline for both retrieval calls (default 5000)
 *   <li>{@code rerank-timeout-ms} - timeout for one reranker model invocation (default 10000)
 *   <li>{@code query-prefix} - instruction prepended to the query before embedding it
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "lexsearch.search")
public class SearchProperties {

  /**
   * BGE query prefix recommended by the bge-small-en-v1.5 model documentation. Prepended to search
   * queries, never to passages at ingestion time.
   */
  public static final String BGE_QUERY_PREFIX =
      "Represent this sentence for searching relevant passages: ";

  private double alpha = 0.5;
  private double lambda = 0.7;
  private int maxPreK = 500;
  private long retrievalTimeoutMs = 5000;
  private long rerankTimeoutMs = 10000;
  private String queryPrefix = BGE_QUERY_PREFIX;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (!(alpha >= 0.0 && alpha <= 1.0)) {
      throw new IllegalStateException(
          "lexsearch.search.alpha must be in [0.0, 1.0], got: " + alpha);
    }
    if (!(lambda >= 0.0 && lambda <= 1.0)) {
      throw new IllegalStateException(
          "lexsearch.search.lambda must be in [0.0, 1.0], got: " + lambda);
    }
    if (maxPreK < 1) {
      throw new IllegalStateException(
          "lexsearch.search.max-pre-k must be at least 1, got: " + maxPreK);
    }
    if (retrievalTimeoutMs < 1 || rerankTimeoutMs < 1) {
      throw new IllegalStateException(
          "lexsearch.search timeouts must be positive, got retrieval="
              + retrievalTimeoutMs
              + ", rerank="
              + rerankTimeoutMs);
    }
  }

  public double getAlpha() {
    return alpha;
  }

  public void setAlpha(double alpha) {
    this.alpha = alpha;
  }

  public double getLambda() {
    return lambda;
  }

  public void setLambda(double lambda) {
    this.lambda = lambda;
  }

  public int getMaxPreK() {
    return maxPreK;
  }

  public void setMaxPreK(int maxPreK) {
    this.maxPreK = maxPreK;
  }

  public long getRetrievalTimeoutMs() {
    return retrievalTimeoutMs;
  }

  public void setRetrievalTimeoutMs(long retrievalTimeoutMs) {
    this.retrievalTimeoutMs = retrievalTimeoutMs;
  }

  public long getRerankTimeoutMs() {
    return rerankTimeoutMs;
  }

  public void setRerankTimeoutMs(long rerankTimeoutMs) {
    this.rerankTimeoutMs = rerankTimeoutMs;
  }

  public String getQueryPrefix() {
    return queryPrefix;
  }

  public void setQueryPrefix(String queryPrefix) {
    this.queryPrefix = queryPrefix;
  }
}
