package dev.ppee.search;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Result of a rerank pass.
 *
 * @param candidates reranked candidates, or the input order when degraded
 * @param degraded true when the cross-encoder failed and the input order was kept
 * @param warning user-safe explanation of the degradation, null otherwise
 */
public record RerankOutcome(
    List<RetrievalCandidate> candidates, boolean degraded, @Nullable String warning) {

  public RerankOutcome {
    candidates = List.copyOf(candidates);
  }

  static RerankOutcome reranked(List<RetrievalCandidate> candidates) {
    return new RerankOutcome(candidates, false, null);
  }

  static RerankOutcome degraded(List<RetrievalCandidate> candidates, String warning) {
    return new RerankOutcome(candidates, true, warning);
  }
}
