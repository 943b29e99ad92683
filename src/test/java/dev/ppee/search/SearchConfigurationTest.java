package dev.ppee.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class SearchConfigurationTest {

  private final SearchConfigurationFactory factory =
      new SearchConfigurationFactory(new SearchProperties());

  @Test
  void defaultsComeFromProperties() {
    SearchConfiguration config =
        factory.create(null, null, null, null, null, null, null, null, null);

    assertThat(config.searchLimit()).isEqualTo(5);
    assertThat(config.useReranker()).isFalse();
    assertThat(config.rerankLimit()).isEqualTo(20);
    assertThat(config.useSmartSearch()).isTrue();
    assertThat(config.vectorWeight()).isEqualTo(0.5);
    assertThat(config.textWeight()).isEqualTo(0.5);
    assertThat(config.hybridThreshold()).isEqualTo(10);
    assertThat(config.useFullScan()).isFalse();
    assertThat(config.usesLlm()).isFalse();
  }

  @Test
  void vectorWeightAboveOneIsRejected() {
    assertThatThrownBy(() -> factory.create(5, false, null, true, 1.5, 0.5, 10, false, null))
        .isInstanceOf(SearchValidationException.class)
        .hasMessageContaining("vectorWeight");
  }

  @Test
  void negativeTextWeightIsRejected() {
    assertThatThrownBy(() -> factory.create(5, false, null, true, 0.5, -0.1, 10, false, null))
        .isInstanceOf(SearchValidationException.class)
        .hasMessageContaining("textWeight");
  }

  @Test
  void nanWeightIsRejected() {
    assertThatThrownBy(
            () -> factory.create(5, false, null, true, Double.NaN, 0.5, 10, false, null))
        .isInstanceOf(SearchValidationException.class);
  }

  @Test
  void weightsNeedNotSumToOne() {
    SearchConfiguration config = factory.create(5, false, null, true, 1.0, 1.0, 10, false, null);

    assertThat(config.vectorWeight() + config.textWeight()).isEqualTo(2.0);
  }

  @ParameterizedTest
  @ValueSource(ints = {0, -1, 101})
  void searchLimitOutOfRangeIsRejected(int limit) {
    assertThatThrownBy(() -> factory.create(limit, false, null, true, null, null, null, null, null))
        .isInstanceOf(SearchValidationException.class)
        .hasMessageContaining("searchLimit");
  }

  @Test
  void rerankLimitAllIsParsed() {
    SearchConfiguration config = factory.create(5, true, "ALL", true, null, null, null, null, null);

    assertThat(config.rerankAll()).isTrue();
    assertThat(config.rerankLimit()).isEqualTo(SearchConfiguration.RERANK_ALL);
  }

  @ParameterizedTest
  @ValueSource(strings = {"0", "-3", "ten"})
  void invalidRerankLimitIsRejected(String raw) {
    assertThatThrownBy(() -> factory.create(5, true, raw, true, null, null, null, null, null))
        .isInstanceOf(SearchValidationException.class)
        .hasMessageContaining("rerankLimit");
  }

  @Test
  void negativeHybridThresholdIsRejected() {
    assertThatThrownBy(() -> factory.create(5, false, null, true, null, null, -1, null, null))
        .isInstanceOf(SearchValidationException.class);
  }

  @Test
  void llmOptionsFallBackToDefaults() {
    LlmOptions llm = factory.llmOptions(null, " ", null, null, "  ");

    assertThat(llm.model()).isEqualTo("gemma3:27b");
    assertThat(llm.promptTemplate()).contains("{query}").contains("{context}");
    assertThat(llm.temperature()).isEqualTo(0.1);
    assertThat(llm.maxTokens()).isEqualTo(1000);
    assertThat(llm.llmQuery()).isNull();
    assertThat(llm.effectiveQuery("адрес")).isEqualTo("адрес");
  }

  @Test
  void llmQueryOverridesSearchQuery() {
    LlmOptions llm = factory.llmOptions("llama3", null, 0.0, 200, " Какой адрес? ");

    assertThat(llm.effectiveQuery("адрес")).isEqualTo("Какой адрес?");
  }

  @Test
  void llmTemperatureOutOfRangeIsRejected() {
    assertThatThrownBy(() -> factory.llmOptions("llama3", null, 2.5, null, null))
        .isInstanceOf(SearchValidationException.class)
        .hasMessageContaining("temperature");
  }

  @Test
  void llmMaxTokensMustBePositive() {
    assertThatThrownBy(() -> factory.llmOptions("llama3", null, null, 0, null))
        .isInstanceOf(SearchValidationException.class);
  }
}
