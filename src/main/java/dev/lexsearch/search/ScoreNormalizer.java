package dev.lexsearch.search;

/**
 * Standardises the raw scores of one retrieval signal onto a common scale (z-scores).
 *
 * <p>Output has zero mean and unit (population) variance over the list. Lists with fewer than two
 * elements and lists whose scores are all identical normalise to all zeros.
 */
public final class ScoreNormalizer {

  private ScoreNormalizer() {}

  /**
   * Computes {@code (x - mean) / stddev} for every score.
   *
   * @param raw raw scores of a single signal, larger is better
   * @return standardised scores, same length and order as {@code raw}
   */
  public static double[] standardize(double[] raw) {
    double[] normalized = new double[raw.length];
    if (raw.length < 2 || allEqual(raw)) {
      return normalized;
    }

    double sum = 0.0;
    for (double score : raw) {
      sum += score;
    }
    double mean = sum / raw.length;

    double squaredDeviations = 0.0;
    for (double score : raw) {
      squaredDeviations += (score - mean) * (score - mean);
    }
    double stddev = Math.sqrt(squaredDeviations / raw.length);
    if (stddev == 0.0) {
      return normalized;
    }

    for (int i = 0; i < raw.length; i++) {
      normalized[i] = (raw[i] - mean) / stddev;
    }
    return normalized;
  }

  // Identical inputs can still produce a tiny non-zero stddev through rounding of the mean.
  private static boolean allEqual(double[] raw) {
    for (int i = 1; i < raw.length; i++) {
      if (Double.compare(raw[i], raw[0]) != 0) {
        return false;
      }
    }
    return true;
  }
}
