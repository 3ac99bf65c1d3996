package dev.lexsearch.retrieval;

import dev.lexsearch.passage.Passage;
import java.util.List;

/** A {@link CandidateSource} that can also be written to by corpus ingestion. */
public interface PassageIndex extends CandidateSource {

  /**
   * Adds or replaces passages, keyed by passage id.
   *
   * @param passages passages whose embeddings all have the index dimension
   * @throws IllegalArgumentException if a passage embedding has the wrong dimension
   */
  void addAll(List<Passage> passages);

  /** Returns the number of passages currently indexed. */
  long size();
}
