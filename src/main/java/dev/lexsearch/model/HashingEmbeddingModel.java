package dev.lexsearch.model;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;
import java.util.Random;

/**
 * Deterministic stand-in for a neural embedding model.
 *
 * <p>The first 8 bytes of the SHA-256 digest of the text seed a Gaussian generator; the resulting
 * vector is L2-normalised. Identical texts always map to identical vectors, different texts to
 * nearly orthogonal ones. There is no notion of meaning: only exact text equality is "similar".
 */
public class HashingEmbeddingModel implements EmbeddingModel {

  private static final double NORM_EPSILON = 1e-9;

  private final int dimension;

  public HashingEmbeddingModel(int dimension) {
    if (dimension < 1) {
      throw new IllegalArgumentException("dimension must be at least 1, got: " + dimension);
    }
    this.dimension = dimension;
  }

  @Override
  public Response<List<Embedding>> embedAll(List<TextSegment> segments) {
    return Response.from(segments.stream().map(s -> hashEmbedding(s.text())).toList());
  }

  @Override
  public int dimension() {
    return dimension;
  }

  Embedding hashEmbedding(String text) {
    Random random = new Random(seed(text));
    double[] values = new double[dimension];
    double squaredNorm = 0.0;
    for (int i = 0; i < dimension; i++) {
      values[i] = random.nextGaussian();
      squaredNorm += values[i] * values[i];
    }
    double norm = Math.sqrt(squaredNorm) + NORM_EPSILON;
    float[] vector = new float[dimension];
    for (int i = 0; i < dimension; i++) {
      vector[i] = (float) (values[i] / norm);
    }
    return Embedding.from(vector);
  }

  private static long seed(String text) {
    try {
      byte[] digest =
          MessageDigest.getInstance("SHA-256").digest(text.getBytes(StandardCharsets.UTF_8));
      return ByteBuffer.wrap(digest, 0, Long.BYTES).getLong();
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }
}
