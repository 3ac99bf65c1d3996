package dev.lexsearch.config;

import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Model strategy selection, bound from {@code lexsearch.models.*}.
 *
 * @param embedding query and passage embedding model
 * @param reranker pairwise scoring model used by the reranker
 */
@ConfigurationProperties(prefix = "lexsearch.models")
public record ModelProperties(
    @DefaultValue EmbeddingSettings embedding, @DefaultValue RerankerSettings reranker) {

  public enum EmbeddingStrategy {
    /** In-process bge-small-en-v1.5 quantized model (384 dimensions). */
    ONNX,
    /** Deterministic hash-seeded vectors; no model files needed. */
    HASHING
  }

  public enum RerankerStrategy {
    /** In-process ONNX cross-encoder (ms-marco-MiniLM-L-6-v2). */
    CROSS_ENCODER,
    /** Jaccard overlap of query and passage tokens. */
    TOKEN_OVERLAP
  }

  /** What happens when the cross-encoder cannot be loaded or invoked. */
  public enum UnavailablePolicy {
    FAIL,
    FALLBACK
  }

  public record EmbeddingSettings(
      @DefaultValue("ONNX") EmbeddingStrategy strategy, @DefaultValue("384") int dimension) {

    public EmbeddingSettings {
      if (dimension < 1) {
        throw new IllegalStateException(
            "lexsearch.models.embedding.dimension must be at least 1, got: " + dimension);
      }
    }
  }

  public record RerankerSettings(
      @DefaultValue("CROSS_ENCODER") RerankerStrategy strategy,
      @Nullable String modelPath,
      @Nullable String tokenizerPath,
      @DefaultValue("FAIL") UnavailablePolicy onUnavailable,
      @DefaultValue("false") boolean sigmoid) {}
}
