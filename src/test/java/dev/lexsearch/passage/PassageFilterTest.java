package dev.lexsearch.passage;

import static org.assertj.core.api.Assertions.assertThat;

import dev.lexsearch.fixture.PassageBuilder;
import org.junit.jupiter.api.Test;

class PassageFilterTest {

  private final Passage penalCode = new PassageBuilder().year(1860).category("act").build();

  private final Passage undated = new PassageBuilder().build();

  @Test
  void noneMatchesEverything() {
    assertThat(PassageFilter.NONE.isEmpty()).isTrue();
    assertThat(PassageFilter.NONE.matches(penalCode)).isTrue();
    assertThat(PassageFilter.NONE.matches(undated)).isTrue();
  }

  @Test
  void yearIsExactMatch() {
    assertThat(PassageFilter.byYear(1860).matches(penalCode)).isTrue();
    assertThat(PassageFilter.byYear(1861).matches(penalCode)).isFalse();
    assertThat(PassageFilter.byYear(1860).matches(undated)).isFalse();
  }

  @Test
  void categoryIsExactAndCaseSensitive() {
    assertThat(PassageFilter.byCategory("act").matches(penalCode)).isTrue();
    assertThat(PassageFilter.byCategory("Act").matches(penalCode)).isFalse();
  }

  @Test
  void bothConstraintsMustHold() {
    assertThat(new PassageFilter(1860, "act").matches(penalCode)).isTrue();
    assertThat(new PassageFilter(1860, "constitution").matches(penalCode)).isFalse();
    assertThat(new PassageFilter(1860, "act").isEmpty()).isFalse();
  }
}
