package dev.ppee.extraction;

import dev.ppee.search.LlmOptions;
import dev.ppee.search.RetrievalCandidate;
import dev.ppee.search.SearchMethod;
import java.util.List;

/**
 * Input of the extraction stage.
 *
 * @param applicationId the application being searched, needed for a full scan
 * @param query the search query
 * @param candidates ranked candidates forming the prompt context
 * @param method how the candidates were retrieved
 * @param options LLM options
 * @param useFullScan whether a "not found" answer triggers a scan of every chunk
 */
public record ExtractionRequest(
    String applicationId,
    String query,
    List<RetrievalCandidate> candidates,
    SearchMethod method,
    LlmOptions options,
    boolean useFullScan) {

  public ExtractionRequest {
    candidates = List.copyOf(candidates);
  }
}
