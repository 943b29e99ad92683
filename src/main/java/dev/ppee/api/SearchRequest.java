package dev.ppee.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.jspecify.annotations.Nullable;

/**
 * Body of a search submission. Every option except the query is optional and falls back to the
 * {@code ppee.search.*} defaults.
 *
 * @param rerankLimit a positive number or {@code "all"}
 * @param llm LLM post-processing options; absent means no LLM stage
 */
public record SearchRequest(
    @NotBlank String query,
    @Nullable Integer searchLimit,
    @Nullable Boolean useReranker,
    @Nullable String rerankLimit,
    @Nullable Boolean useSmartSearch,
    @Nullable Double vectorWeight,
    @Nullable Double textWeight,
    @Nullable Integer hybridThreshold,
    @Nullable Boolean useFullScan,
    @Valid @Nullable LlmRequest llm) {

  /** LLM options of a search submission; null fields take the configured defaults. */
  public record LlmRequest(
      @Nullable String model,
      @Nullable String promptTemplate,
      @Nullable Double temperature,
      @Nullable Integer maxTokens,
      @Nullable String llmQuery) {}
}
