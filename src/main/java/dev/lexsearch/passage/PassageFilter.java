package dev.lexsearch.passage;

import org.jspecify.annotations.Nullable;

/**
 * Exact-match constraints on the denormalized passage attributes. A {@code null} field places no
 * constraint on that attribute; both fields {@code null} matches every passage.
 *
 * @param year optional exact year
 * @param category optional exact category
 */
public record PassageFilter(@Nullable Integer year, @Nullable String category) {

  /** Filter that matches every passage. */
  public static final PassageFilter NONE = new PassageFilter(null, null);

  public static PassageFilter byCategory(String category) {
    return new PassageFilter(null, category);
  }

  public static PassageFilter byYear(int year) {
    return new PassageFilter(year, null);
  }

  public boolean isEmpty() {
    return year == null && category == null;
  }

  public boolean matches(Passage passage) {
    return (year == null || year.equals(passage.year()))
        && (category == null || category.equals(passage.category()));
  }
}
