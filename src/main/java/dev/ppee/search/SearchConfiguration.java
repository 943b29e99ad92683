package dev.ppee.search;

import java.util.Locale;
import org.jspecify.annotations.Nullable;

/**
 * Retrieval and post-processing options of a single search. Validated once on construction and
 * immutable afterwards.
 *
 * @param searchLimit number of results returned, in [1, 100]
 * @param useReranker whether the cross-encoder re-scores candidates
 * @param rerankLimit how many leading candidates the reranker scores, or {@link #RERANK_ALL}
 * @param useSmartSearch whether short queries switch to hybrid retrieval
 * @param vectorWeight weight of the normalised vector score in hybrid fusion, in [0, 1]
 * @param textWeight weight of the normalised lexical score in hybrid fusion, in [0, 1]
 * @param hybridThreshold queries shorter than this many characters go hybrid
 * @param useFullScan whether a "not found" answer falls back to scanning every chunk
 * @param llm LLM options; null means no LLM stage
 */
public record SearchConfiguration(
    int searchLimit,
    boolean useReranker,
    int rerankLimit,
    boolean useSmartSearch,
    double vectorWeight,
    double textWeight,
    int hybridThreshold,
    boolean useFullScan,
    @Nullable LlmOptions llm) {

  /** Sentinel rerank limit: score every chunk of the application. */
  public static final int RERANK_ALL = -1;

  public static final int MAX_SEARCH_LIMIT = 100;

  public SearchConfiguration {
    if (searchLimit < 1 || searchLimit > MAX_SEARCH_LIMIT) {
      throw new SearchValidationException(
          "searchLimit must be between 1 and " + MAX_SEARCH_LIMIT + ", got: " + searchLimit);
    }
    if (rerankLimit != RERANK_ALL && rerankLimit < 1) {
      throw new SearchValidationException(
          "rerankLimit must be a positive number or 'all', got: " + rerankLimit);
    }
    requireWeight("vectorWeight", vectorWeight);
    requireWeight("textWeight", textWeight);
    if (hybridThreshold < 0) {
      throw new SearchValidationException(
          "hybridThreshold must be >= 0, got: " + hybridThreshold);
    }
  }

  public boolean rerankAll() {
    return rerankLimit == RERANK_ALL;
  }

  public boolean usesLlm() {
    return llm != null;
  }

  /**
   * Parses a user-supplied rerank limit: a positive integer or {@code "all"}.
   *
   * @param raw the raw value, null or blank for the default
   * @param defaultLimit value used when {@code raw} is absent
   * @return the parsed limit or {@link #RERANK_ALL}
   */
  public static int parseRerankLimit(@Nullable String raw, int defaultLimit) {
    if (raw == null || raw.isBlank()) {
      return defaultLimit;
    }
    String trimmed = raw.trim();
    if ("all".equals(trimmed.toLowerCase(Locale.ROOT))) {
      return RERANK_ALL;
    }
    try {
      return Integer.parseInt(trimmed);
    } catch (NumberFormatException e) {
      throw new SearchValidationException(
          "rerankLimit must be a positive number or 'all', got: " + raw);
    }
  }

  private static void requireWeight(String name, double weight) {
    if (Double.isNaN(weight) || weight < 0.0 || weight > 1.0) {
      throw new SearchValidationException(name + " must be in [0.0, 1.0], got: " + weight);
    }
  }
}
