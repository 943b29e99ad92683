package dev.ppee.search;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.scoring.ScoringModel;
import java.util.List;
import java.util.stream.IntStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Cross-encoder reranking service that re-scores retrieval candidates using an ONNX-based scoring
 * model (bge-reranker-v2-m3).
 *
 * <p>Only the first {@code rerankLimit} candidates are scored; the rest are dropped. Results are
 * sorted by reranking score descending and limited to {@code topK}. Retrieval scores are kept on
 * each candidate.
 *
 * <p>On scoring failure the service degrades instead of failing the task: it logs a warning and
 * returns the input order, limited to {@code topK}, flagged as degraded.
 *
 * @see dev.langchain4j.model.scoring.ScoringModel
 */
@Service
public class RerankerService {

  private static final Logger log = LoggerFactory.getLogger(RerankerService.class);

  private final ScoringModel scoringModel;

  public RerankerService(ScoringModel scoringModel) {
    this.scoringModel = scoringModel;
  }

  /**
   * Reranks candidates with the cross-encoder.
   *
   * @param query the text the candidates are scored against
   * @param candidates candidates in retrieval order
   * @param rerankLimit number of leading candidates to score, or {@link
   *     SearchConfiguration#RERANK_ALL}
   * @param topK maximum number of results to return
   * @return reranked candidates, or the degraded input order
   */
  public RerankOutcome rerank(
      String query, List<RetrievalCandidate> candidates, int rerankLimit, int topK) {
    if (candidates.isEmpty()) {
      return RerankOutcome.reranked(List.of());
    }

    int poolSize =
        rerankLimit == SearchConfiguration.RERANK_ALL
            ? candidates.size()
            : Math.min(rerankLimit, candidates.size());
    List<RetrievalCandidate> pool = candidates.subList(0, poolSize);

    try {
      List<Double> scores = scoreAll(query, pool);
      List<RetrievalCandidate> reranked =
          IntStream.range(0, pool.size())
              .mapToObj(i -> pool.get(i).withRerankScore(scores.get(i)))
              .sorted(RetrievalCandidate.BY_EFFECTIVE_SCORE)
              .limit(topK)
              .toList();
      log.debug("Reranked {} of {} candidates", pool.size(), candidates.size());
      return RerankOutcome.reranked(reranked);
    } catch (RerankUnavailableException e) {
      log.warn("Reranking failed, keeping retrieval order: {}", e.getMessage(), e);
      return RerankOutcome.degraded(
          candidates.stream().limit(topK).toList(), e.userMessage());
    }
  }

  private List<Double> scoreAll(String query, List<RetrievalCandidate> pool) {
    List<TextSegment> segments = pool.stream().map(c -> TextSegment.from(c.text())).toList();
    Response<List<Double>> response;
    try {
      response = scoringModel.scoreAll(segments, query);
    } catch (RuntimeException e) {
      throw new RerankUnavailableException("Scoring model failed: " + e.getMessage(), e);
    }
    List<Double> scores = response == null ? null : response.content();
    if (scores == null || scores.size() != pool.size()) {
      throw new RerankUnavailableException(
          "Scoring model returned %s scores for %d candidates"
              .formatted(scores == null ? "no" : String.valueOf(scores.size()), pool.size()));
    }
    return scores;
  }
}
