package dev.lexsearch.config;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.bgesmallenv15q.BgeSmallEnV15QuantizedEmbeddingModel;
import dev.langchain4j.model.scoring.ScoringModel;
import dev.langchain4j.model.scoring.onnx.OnnxScoringModel;
import dev.lexsearch.config.ModelProperties.RerankerSettings;
import dev.lexsearch.config.ModelProperties.UnavailablePolicy;
import dev.lexsearch.model.HashingEmbeddingModel;
import dev.lexsearch.model.TokenOverlapScoringModel;
import dev.lexsearch.search.RerankerService;
import dev.lexsearch.search.RerankerUnavailableException;
import dev.lexsearch.search.SearchProperties;
import java.time.Duration;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures the embedding model, the pairwise scoring model and the reranker.
 *
 * <p>Both models run in-process: the ONNX bge-small-en-v1.5 quantized embedding model and an ONNX
 * cross-encoder, with deterministic degraded strategies ({@link HashingEmbeddingModel}, {@link
 * TokenOverlapScoringModel}) selectable for tests and model-less deployments. Models are loaded
 * once at startup and shared by all queries.
 *
 * @see dev.lexsearch.search.SearchService
 */
@Configuration
@EnableConfigurationProperties(ModelProperties.class)
public class ModelConfig {

  private static final Logger log = LoggerFactory.getLogger(ModelConfig.class);

  static final int BGE_SMALL_DIMENSION = 384;

  /**
   * Provides the embedding model selected by {@code lexsearch.models.embedding.strategy}.
   *
   * @throws IllegalStateException if the ONNX model is selected with a dimension other than 384
   */
  @Bean
  public EmbeddingModel embeddingModel(ModelProperties properties) {
    int dimension = properties.embedding().dimension();
    switch (properties.embedding().strategy()) {
      case HASHING:
        log.info("Embedding model: hashing ({} dimensions)", dimension);
        return new HashingEmbeddingModel(dimension);
      case ONNX:
      default:
        if (dimension != BGE_SMALL_DIMENSION) {
          throw new IllegalStateException(
              "bge-small-en-v1.5 produces "
                  + BGE_SMALL_DIMENSION
                  + "-dimensional embeddings, but lexsearch.models.embedding.dimension is "
                  + dimension);
        }
        log.info("Embedding model: bge-small-en-v1.5 quantized (ONNX)");
        return new BgeSmallEnV15QuantizedEmbeddingModel();
    }
  }

  /**
   * Provides the pairwise scoring model selected by {@code lexsearch.models.reranker.strategy}.
   *
   * <p>If the cross-encoder cannot be loaded and {@code on-unavailable} is {@code FALLBACK}, the
   * token-overlap model is used instead; with {@code FAIL} startup aborts.
   *
   * @throws RerankerUnavailableException if the cross-encoder cannot be loaded and no fallback is
   *     allowed
   */
  @Bean
  public ScoringModel scoringModel(ModelProperties properties) {
    RerankerSettings settings = properties.reranker();
    if (settings.strategy() == ModelProperties.RerankerStrategy.TOKEN_OVERLAP) {
      log.info("Reranker model: token overlap");
      return new TokenOverlapScoringModel();
    }
    try {
      if (settings.modelPath() == null || settings.tokenizerPath() == null) {
        throw new IllegalStateException(
            "lexsearch.models.reranker.model-path and tokenizer-path are required for the"
                + " cross-encoder");
      }
      ScoringModel model = new OnnxScoringModel(settings.modelPath(), settings.tokenizerPath());
      log.info("Reranker model: ONNX cross-encoder from {}", settings.modelPath());
      return model;
    } catch (RuntimeException e) {
      if (settings.onUnavailable() == UnavailablePolicy.FALLBACK) {
        log.warn(
            "Cross-encoder could not be loaded ({}); falling back to token overlap reranking",
            e.getMessage());
        return new TokenOverlapScoringModel();
      }
      throw new RerankerUnavailableException("Cross-encoder could not be loaded", e);
    }
  }

  /**
   * Provides the reranker. With {@code on-unavailable: FALLBACK} a token-overlap model backs up a
   * cross-encoder that fails at query time; logit calibration applies to cross-encoder scores only.
   */
  @Bean
  public RerankerService rerankerService(
      ScoringModel scoringModel,
      ModelProperties properties,
      SearchProperties searchProperties,
      @Qualifier("searchExecutor") Executor searchExecutor) {
    RerankerSettings settings = properties.reranker();
    boolean crossEncoder = !(scoringModel instanceof TokenOverlapScoringModel);
    ScoringModel fallback =
        crossEncoder && settings.onUnavailable() == UnavailablePolicy.FALLBACK
            ? new TokenOverlapScoringModel()
            : null;
    return new RerankerService(
        scoringModel,
        fallback,
        searchExecutor,
        Duration.ofMillis(searchProperties.getRerankTimeoutMs()),
        crossEncoder && settings.sigmoid());
  }
}
