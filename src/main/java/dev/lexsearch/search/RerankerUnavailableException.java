package dev.lexsearch.search;

/**
 * Thrown when the pairwise reranking model cannot be loaded, fails, times out or returns a
 * malformed response, and no fallback reranker is configured.
 */
public class RerankerUnavailableException extends SearchException {

  public RerankerUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }

  public RerankerUnavailableException(String message) {
    super(message);
  }

  @Override
  public Kind kind() {
    return Kind.RERANKER_UNAVAILABLE;
  }
}
