package dev.lexsearch.retrieval;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Weighted term-frequency ranking used by {@link InMemoryPassageIndex}.
 *
 * <p>Mirrors the weighting of the persisted {@code search_vector}: heading terms count {@value
 * #HEADING_WEIGHT}, body terms {@value #BODY_WEIGHT}. The sum is damped by body length so that long
 * passages do not win on volume alone. English stop words are ignored.
 */
final class LexicalScorer {

  static final double HEADING_WEIGHT = 1.0;
  static final double BODY_WEIGHT = 0.4;

  private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{Nd}]+");

  private static final Set<String> STOP_WORDS =
      Set.of(
          "a", "an", "and", "are", "as", "at", "be", "by", "for", "from", "has", "have", "in", "is",
          "it", "its", "of", "on", "or", "that", "the", "this", "to", "was", "were", "which",
          "with", "what", "when", "where", "who", "how");

  private LexicalScorer() {}

  /** Distinct non-stop-word query terms, in order of first occurrence. */
  static Set<String> queryTerms(String text) {
    return new LinkedHashSet<>(terms(text));
  }

  /** Lower-cased, non-stop-word terms of {@code text}. */
  static List<String> terms(@Nullable String text) {
    List<String> terms = new ArrayList<>();
    if (text == null || text.isBlank()) {
      return terms;
    }
    for (String token : NON_WORD.split(text.toLowerCase(Locale.ROOT))) {
      if (!token.isEmpty() && !STOP_WORDS.contains(token)) {
        terms.add(token);
      }
    }
    return terms;
  }

  static Map<String, Integer> termFrequencies(List<String> terms) {
    Map<String, Integer> frequencies = new HashMap<>();
    for (String term : terms) {
      frequencies.merge(term, 1, Integer::sum);
    }
    return frequencies;
  }

  /**
   * Scores one passage. Returns 0.0 when no query term occurs in heading or body, which callers
   * treat as "not a match".
   */
  static double score(
      Set<String> queryTerms,
      Map<String, Integer> headingFrequencies,
      Map<String, Integer> bodyFrequencies,
      int bodyLength) {
    double weighted = 0.0;
    for (String term : queryTerms) {
      weighted += HEADING_WEIGHT * headingFrequencies.getOrDefault(term, 0);
      weighted += BODY_WEIGHT * bodyFrequencies.getOrDefault(term, 0);
    }
    if (weighted == 0.0) {
      return 0.0;
    }
    return weighted / (1.0 + Math.log1p(bodyLength));
  }
}
