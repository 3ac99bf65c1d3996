package dev.lexsearch.passage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.lexsearch.fixture.PassageBuilder;
import org.junit.jupiter.api.Test;

class PassageTest {

  @Test
  void contextTextFallsBackToText() {
    Passage passage = new PassageBuilder().text("Body.").build();

    assertThat(passage.contextText()).isEqualTo("Body.");
  }

  @Test
  void contextTextPrefersParentText() {
    Passage passage = new PassageBuilder().text("Body.").parentText("Whole section. Body.").build();

    assertThat(passage.contextText()).isEqualTo("Whole section. Body.");
  }

  @Test
  void emptyParentTextCountsAsAbsent() {
    Passage passage = new PassageBuilder().text("Body.").parentText("").build();

    assertThat(passage.contextText()).isEqualTo("Body.");
  }

  @Test
  void blankTextIsRejected() {
    assertThatThrownBy(() -> new PassageBuilder().id("p9").text("  ").build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("p9");
  }

  @Test
  void idIsRequired() {
    assertThatThrownBy(() -> new PassageBuilder().id(null).build())
        .isInstanceOf(NullPointerException.class);
  }

  @Test
  void dimensionComesFromEmbedding() {
    assertThat(new PassageBuilder().embedding(0.1f, 0.2f, 0.3f, 0.4f).build().dimension())
        .isEqualTo(4);
  }
}
