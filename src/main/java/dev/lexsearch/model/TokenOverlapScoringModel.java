package dev.lexsearch.model;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.scoring.ScoringModel;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Deterministic pairwise relevance scorer: Jaccard similarity between the lower-cased
 * whitespace-separated tokens of the query and of each candidate text.
 *
 * <p>Scores lie in [0, 1]; 0.0 when either side has no tokens. Used where the cross-encoder model
 * files are not available, and as the declared fallback reranker.
 */
public class TokenOverlapScoringModel implements ScoringModel {

  @Override
  public Response<List<Double>> scoreAll(List<TextSegment> segments, String query) {
    Set<String> queryTokens = tokens(query);
    return Response.from(
        segments.stream().map(segment -> jaccard(queryTokens, tokens(segment.text()))).toList());
  }

  static double jaccard(Set<String> left, Set<String> right) {
    if (left.isEmpty() || right.isEmpty()) {
      return 0.0;
    }
    Set<String> intersection = new HashSet<>(left);
    intersection.retainAll(right);
    Set<String> union = new HashSet<>(left);
    union.addAll(right);
    return (double) intersection.size() / union.size();
  }

  static Set<String> tokens(String text) {
    Set<String> tokens = new HashSet<>();
    for (String token : text.toLowerCase(Locale.ROOT).split("\\s+")) {
      if (!token.isEmpty()) {
        tokens.add(token);
      }
    }
    return tokens;
  }
}
