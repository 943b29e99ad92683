package dev.ppee.search;

import org.springframework.stereotype.Component;

/**
 * Chooses between vector and hybrid retrieval.
 *
 * <p>Short queries (a word or two, an abbreviation) embed poorly, so with smart search enabled a
 * query shorter than the configured threshold also runs a lexical search. Length is counted in
 * code points of the trimmed query. Pure and deterministic.
 */
@Component
public class RetrievalStrategySelector {

  /**
   * Selects the retrieval strategy for a query.
   *
   * @param query the search query
   * @param config the search configuration
   * @return vector, or hybrid with the configured weights
   * @throws SearchValidationException if the query is null or blank
   */
  public RetrievalStrategy select(String query, SearchConfiguration config) {
    if (query == null || query.isBlank()) {
      throw new SearchValidationException("Query must not be empty");
    }
    if (!config.useSmartSearch()) {
      return RetrievalStrategy.vector();
    }
    String trimmed = query.strip();
    int length = trimmed.codePointCount(0, trimmed.length());
    if (length < config.hybridThreshold()) {
      return RetrievalStrategy.hybrid(config.vectorWeight(), config.textWeight());
    }
    return RetrievalStrategy.vector();
  }
}
