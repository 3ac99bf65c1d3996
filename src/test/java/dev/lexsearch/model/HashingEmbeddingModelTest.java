package dev.lexsearch.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.CosineSimilarity;
import java.util.List;
import org.junit.jupiter.api.Test;

class HashingEmbeddingModelTest {

  private final HashingEmbeddingModel model = new HashingEmbeddingModel(384);

  @Test
  void producesUnitVectorsOfConfiguredDimension() {
    Embedding embedding = model.embed("Right to property").content();

    assertThat(embedding.dimension()).isEqualTo(384);
    double squaredNorm = 0.0;
    for (float component : embedding.vector()) {
      squaredNorm += component * component;
    }
    assertThat(Math.sqrt(squaredNorm)).isCloseTo(1.0, within(1e-5));
    assertThat(model.dimension()).isEqualTo(384);
  }

  @Test
  void sameTextAlwaysYieldsSameVector() {
    float[] first = model.embed("Section 302").content().vector();
    float[] second = new HashingEmbeddingModel(384).embed("Section 302").content().vector();

    assertThat(second).containsExactly(first);
  }

  @Test
  void differentTextsAreNearlyOrthogonal() {
    Embedding a = model.embed("punishment for murder").content();
    Embedding b = model.embed("transfer of property").content();

    assertThat(Math.abs(CosineSimilarity.between(a, b))).isLessThan(0.3);
  }

  @Test
  void embedsBatchInInputOrder() {
    List<Embedding> batch =
        model.embedAll(List.of(TextSegment.from("one"), TextSegment.from("two"))).content();

    assertThat(batch).hasSize(2);
    assertThat(batch.get(0).vector()).containsExactly(model.embed("one").content().vector());
    assertThat(batch.get(1).vector()).containsExactly(model.embed("two").content().vector());
  }

  @Test
  void rejectsNonPositiveDimension() {
    assertThatThrownBy(() -> new HashingEmbeddingModel(0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
