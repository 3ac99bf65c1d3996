package dev.lexsearch.search;

/**
 * Base class for search pipeline failures that are surfaced to the caller. {@link #kind()} tells
 * callers which part of the pipeline failed without inspecting exception types.
 */
public abstract class SearchException extends RuntimeException {

  /** Failure categories exposed to callers. */
  public enum Kind {
    /** A Candidate Source call (or query embedding) failed or timed out. */
    RETRIEVAL_FAILURE,
    /** The pairwise reranking model could not be loaded or invoked. */
    RERANKER_UNAVAILABLE
  }

  protected SearchException(String message, Throwable cause) {
    super(message, cause);
  }

  protected SearchException(String message) {
    super(message);
  }

  public abstract Kind kind();
}
