package dev.lexsearch.search;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class SearchPropertiesTest {

  @Test
  void defaultsAreValid() {
    assertThatCode(() -> new SearchProperties().validate()).doesNotThrowAnyException();
  }

  @Test
  void alphaOutsideUnitIntervalIsRejected() {
    var properties = new SearchProperties();
    properties.setAlpha(1.5);

    assertThatThrownBy(properties::validate)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("alpha");
  }

  @Test
  void negativeLambdaIsRejected() {
    var properties = new SearchProperties();
    properties.setLambda(-0.1);

    assertThatThrownBy(properties::validate).hasMessageContaining("lambda");
  }

  @Test
  void nanWeightsAreRejected() {
    var alphaNaN = new SearchProperties();
    alphaNaN.setAlpha(Double.NaN);
    var lambdaNaN = new SearchProperties();
    lambdaNaN.setLambda(Double.NaN);

    assertThatThrownBy(alphaNaN::validate)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("alpha");
    assertThatThrownBy(lambdaNaN::validate)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("lambda");
  }

  @Test
  void maxPreKMustBePositive() {
    var properties = new SearchProperties();
    properties.setMaxPreK(0);

    assertThatThrownBy(properties::validate).hasMessageContaining("max-pre-k");
  }

  @Test
  void timeoutsMustBePositive() {
    var properties = new SearchProperties();
    properties.setRerankTimeoutMs(0);

    assertThatThrownBy(properties::validate).hasMessageContaining("timeouts");
  }
}
