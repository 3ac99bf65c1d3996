package dev.lexsearch.ingestion;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Recursive character splitter turning a document's full text into overlapping child passages.
 *
 * <p>The text is split on the first separator it contains (paragraph, line, sentence, word, then
 * single characters). Consecutive pieces are merged back up to {@code maxChars}, carrying up to
 * {@code overlapChars} of trailing context into the next passage. Pieces still longer than {@code
 * maxChars} are split again with the next separator. Passages are stripped; blank ones are
 * dropped.
 */
public class PassageSplitter {

  static final int DEFAULT_MAX_CHARS = 1024;
  static final int DEFAULT_OVERLAP_CHARS = 200;
  static final List<String> SEPARATORS = List.of("\n\n", "\n", ". ", " ", "");

  private final int maxChars;
  private final int overlapChars;

  public PassageSplitter() {
    this(DEFAULT_MAX_CHARS, DEFAULT_OVERLAP_CHARS);
  }

  public PassageSplitter(int maxChars, int overlapChars) {
    if (maxChars < 1) {
      throw new IllegalArgumentException("maxChars must be at least 1, got: " + maxChars);
    }
    if (overlapChars < 0 || overlapChars >= maxChars) {
      throw new IllegalArgumentException(
          "overlapChars must be in [0, maxChars), got: " + overlapChars);
    }
    this.maxChars = maxChars;
    this.overlapChars = overlapChars;
  }

  /**
   * Splits text into passages of at most {@code maxChars} characters.
   *
   * @param text the full document text (may be null or blank)
   * @return passages in document order; empty for blank input
   */
  public List<String> split(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    return split(text, SEPARATORS);
  }

  private List<String> split(String text, List<String> separators) {
    int index = separators.size() - 1;
    for (int i = 0; i < separators.size(); i++) {
      String candidate = separators.get(i);
      if (candidate.isEmpty() || text.contains(candidate)) {
        index = i;
        break;
      }
    }
    String separator = separators.get(index);
    List<String> remaining = separators.subList(index + 1, separators.size());

    List<String> passages = new ArrayList<>();
    List<String> fitting = new ArrayList<>();
    for (String piece : pieces(text, separator)) {
      if (piece.length() <= maxChars) {
        fitting.add(piece);
        continue;
      }
      if (!fitting.isEmpty()) {
        passages.addAll(merge(fitting, separator));
        fitting.clear();
      }
      if (remaining.isEmpty()) {
        addStripped(passages, piece);
      } else {
        passages.addAll(split(piece, remaining));
      }
    }
    if (!fitting.isEmpty()) {
      passages.addAll(merge(fitting, separator));
    }
    return passages;
  }

  private static List<String> pieces(String text, String separator) {
    List<String> pieces = new ArrayList<>();
    if (separator.isEmpty()) {
      text.codePoints().forEach(cp -> pieces.add(new String(Character.toChars(cp))));
      return pieces;
    }
    int start = 0;
    int next;
    while ((next = text.indexOf(separator, start)) >= 0) {
      if (next > start) {
        pieces.add(text.substring(start, next));
      }
      start = next + separator.length();
    }
    if (start < text.length()) {
      pieces.add(text.substring(start));
    }
    return pieces;
  }

  /** Greedily packs pieces into passages, keeping an overlap window between neighbours. */
  private List<String> merge(List<String> pieces, String separator) {
    List<String> passages = new ArrayList<>();
    Deque<String> window = new ArrayDeque<>();
    int windowLength = 0;
    for (String piece : pieces) {
      int joinedLength =
          windowLength + piece.length() + (window.isEmpty() ? 0 : separator.length());
      if (joinedLength > maxChars && !window.isEmpty()) {
        addStripped(passages, String.join(separator, window));
        while (!window.isEmpty()
            && (windowLength > overlapChars
                || windowLength + piece.length() + separator.length() > maxChars)) {
          String dropped = window.removeFirst();
          windowLength -= dropped.length() + (window.isEmpty() ? 0 : separator.length());
        }
      }
      windowLength += piece.length() + (window.isEmpty() ? 0 : separator.length());
      window.addLast(piece);
    }
    if (!window.isEmpty()) {
      addStripped(passages, String.join(separator, window));
    }
    return passages;
  }

  private static void addStripped(List<String> passages, String passage) {
    String stripped = passage.strip();
    if (!stripped.isEmpty()) {
      passages.add(stripped);
    }
  }
}
