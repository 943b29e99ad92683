package dev.ppee.search;

import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Builds {@link SearchConfiguration} and {@link LlmOptions} from partially filled requests, taking
 * every missing value from {@link SearchProperties}.
 */
@Component
public class SearchConfigurationFactory {

  private final SearchProperties properties;

  public SearchConfigurationFactory(SearchProperties properties) {
    this.properties = properties;
  }

  /**
   * Creates a validated configuration. Null arguments fall back to the configured defaults.
   *
   * @throws SearchValidationException if any resolved value is out of range
   */
  public SearchConfiguration create(
      @Nullable Integer searchLimit,
      @Nullable Boolean useReranker,
      @Nullable String rerankLimit,
      @Nullable Boolean useSmartSearch,
      @Nullable Double vectorWeight,
      @Nullable Double textWeight,
      @Nullable Integer hybridThreshold,
      @Nullable Boolean useFullScan,
      @Nullable LlmOptions llm) {
    return new SearchConfiguration(
        Objects.requireNonNullElse(searchLimit, properties.getDefaultSearchLimit()),
        Boolean.TRUE.equals(useReranker),
        SearchConfiguration.parseRerankLimit(rerankLimit, properties.getDefaultRerankLimit()),
        Objects.requireNonNullElse(useSmartSearch, Boolean.TRUE),
        Objects.requireNonNullElse(vectorWeight, properties.getVectorWeight()),
        Objects.requireNonNullElse(textWeight, properties.getTextWeight()),
        Objects.requireNonNullElse(hybridThreshold, properties.getHybridThreshold()),
        Boolean.TRUE.equals(useFullScan),
        llm);
  }

  /**
   * Creates LLM options. Null arguments fall back to {@code ppee.search.llm.*}.
   *
   * @throws SearchValidationException if any resolved value is out of range
   */
  public LlmOptions llmOptions(
      @Nullable String model,
      @Nullable String promptTemplate,
      @Nullable Double temperature,
      @Nullable Integer maxTokens,
      @Nullable String llmQuery) {
    SearchProperties.Llm defaults = properties.getLlm();
    return new LlmOptions(
        model == null || model.isBlank() ? defaults.getDefaultModel() : model,
        promptTemplate == null || promptTemplate.isBlank()
            ? defaults.getPromptTemplate()
            : promptTemplate,
        Objects.requireNonNullElse(temperature, defaults.getTemperature()),
        Objects.requireNonNullElse(maxTokens, defaults.getMaxTokens()),
        llmQuery);
  }
}
