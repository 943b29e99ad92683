package dev.ppee.pipeline;

import dev.ppee.extraction.ExtractionResult;
import dev.ppee.search.RetrievalCandidate;
import dev.ppee.search.SearchMethod;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Everything one pass of the search pipeline produced, before it is shaped into a task result.
 *
 * @param query the search query
 * @param method the retrieval method used
 * @param results final ranked candidates
 * @param reranked whether the reranker was requested
 * @param rerankDegraded whether reranking failed and retrieval order was kept
 * @param warnings user-safe warnings collected along the way
 * @param extraction the LLM stage result, null when no LLM stage ran
 * @param executionTimeMs wall-clock duration of the pass
 */
public record SearchRun(
    String query,
    SearchMethod method,
    List<RetrievalCandidate> results,
    boolean reranked,
    boolean rerankDegraded,
    List<String> warnings,
    @Nullable ExtractionResult extraction,
    long executionTimeMs) {

  public SearchRun {
    results = List.copyOf(results);
    warnings = List.copyOf(warnings);
  }
}
