package dev.lexsearch.search;

/**
 * Thrown when one of the two retrieval calls fails or exceeds its timeout. Distinguishes "search
 * unavailable" from "no matches", which is an empty result.
 */
public class RetrievalException extends SearchException {

  /** The retrieval signal whose call failed. */
  public enum Signal {
    LEXICAL,
    SEMANTIC
  }

  private final Signal signal;

  public RetrievalException(Signal signal, String message, Throwable cause) {
    super(message, cause);
    this.signal = signal;
  }

  public RetrievalException(Signal signal, String message) {
    super(message);
    this.signal = signal;
  }

  public Signal getSignal() {
    return signal;
  }

  @Override
  public Kind kind() {
    return Kind.RETRIEVAL_FAILURE;
  }
}
