package dev.ppee.search;

import org.jspecify.annotations.Nullable;

/**
 * Options of the LLM post-processing stage.
 *
 * @param model LLM model name as known to the inference server
 * @param promptTemplate template with {@code {query}} and {@code {context}} placeholders
 * @param temperature sampling temperature in [0, 2]
 * @param maxTokens upper bound on generated tokens
 * @param llmQuery question put to the LLM instead of the search query, if set
 */
public record LlmOptions(
    String model,
    String promptTemplate,
    double temperature,
    int maxTokens,
    @Nullable String llmQuery) {

  public LlmOptions {
    if (model == null || model.isBlank()) {
      throw new SearchValidationException("LLM model must not be blank");
    }
    if (promptTemplate == null || promptTemplate.isBlank()) {
      throw new SearchValidationException("LLM prompt template must not be blank");
    }
    if (Double.isNaN(temperature) || temperature < 0.0 || temperature > 2.0) {
      throw new SearchValidationException(
          "LLM temperature must be in [0.0, 2.0], got: " + temperature);
    }
    if (maxTokens < 1) {
      throw new SearchValidationException("LLM maxTokens must be >= 1, got: " + maxTokens);
    }
    llmQuery = llmQuery == null || llmQuery.isBlank() ? null : llmQuery.trim();
  }

  /** The question substituted for {@code {query}} in the prompt. */
  public String effectiveQuery(String searchQuery) {
    return llmQuery != null ? llmQuery : searchQuery;
  }
}
