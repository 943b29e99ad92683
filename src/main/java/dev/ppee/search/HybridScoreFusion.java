package dev.ppee.search;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Pure static utility for fusing vector and lexical search results with a weighted sum.
 *
 * <p>Applies min-max normalisation to each source's scores independently, then combines them:
 * {@code score = vectorWeight * normVector + textWeight * normText}. The weights are independent
 * and need not sum to 1.
 *
 * <p>This class has no Spring dependencies and no state -- all methods are pure functions.
 */
final class HybridScoreFusion {

  private HybridScoreFusion() {}

  /**
   * Fuses vector and lexical search results.
   *
   * <p>Algorithm:
   *
   * <ol>
   *   <li>Min-max normalise vector scores to [0, 1] (if max == min, all normalise to 1.0)
   *   <li>Min-max normalise lexical scores to [0, 1] (same logic)
   *   <li>Combine by chunk id; a candidate missing from one source gets 0.0 for that component
   *   <li>Label: in both sources {@code hybrid}; lexical-only with a normalised score at or above
   *       {@code textRelevanceFloor} {@code text}; anything else {@code vector}
   *   <li>Sort by combined score descending (stable, vector order first), limit to maxResults
   * </ol>
   *
   * @param vectorResults candidates from vector search, {@code score} holding the raw similarity
   * @param textResults candidates from lexical search, {@code score} holding the raw rank
   * @param vectorWeight weight of the vector component
   * @param textWeight weight of the lexical component
   * @param textRelevanceFloor normalised lexical score needed for the {@code text} label
   * @param maxResults maximum number of results to return
   * @return fused candidates; raw component scores are kept in {@code vectorScore} and {@code
   *     textScore}
   */
  static List<RetrievalCandidate> fuse(
      List<RetrievalCandidate> vectorResults,
      List<RetrievalCandidate> textResults,
      double vectorWeight,
      double textWeight,
      double textRelevanceFloor,
      int maxResults) {
    if (vectorResults.isEmpty() && textResults.isEmpty()) {
      return List.of();
    }

    double vectorMin = minScore(vectorResults);
    double vectorMax = maxScore(vectorResults);
    double textMin = minScore(textResults);
    double textMax = maxScore(textResults);

    // Insertion order keeps vector ranking as the tie-breaker
    Map<String, FusedEntry> fusedMap = new LinkedHashMap<>();

    for (RetrievalCandidate vc : vectorResults) {
      double norm = normalise(vc.score(), vectorMin, vectorMax);
      fusedMap.putIfAbsent(
          vc.chunkId(), new FusedEntry(vc, vc.score(), null, vectorWeight * norm, null));
    }

    for (RetrievalCandidate tc : textResults) {
      double norm = normalise(tc.score(), textMin, textMax);
      double textContribution = textWeight * norm;

      FusedEntry existing = fusedMap.get(tc.chunkId());
      if (existing != null) {
        if (existing.textScore() == null) {
          fusedMap.put(
              tc.chunkId(),
              new FusedEntry(
                  existing.candidate(),
                  existing.vectorScore(),
                  tc.score(),
                  existing.combinedScore() + textContribution,
                  norm));
        }
      } else {
        fusedMap.put(tc.chunkId(), new FusedEntry(tc, null, tc.score(), textContribution, norm));
      }
    }

    return fusedMap.values().stream()
        .sorted(Comparator.comparingDouble(FusedEntry::combinedScore).reversed())
        .limit(maxResults)
        .map(entry -> entry.toCandidate(textRelevanceFloor))
        .toList();
  }

  /**
   * Min-max normalises a score to [0, 1]. If max == min (all scores identical), returns 1.0.
   */
  static double normalise(double score, double min, double max) {
    if (max == min) {
      return 1.0;
    }
    return (score - min) / (max - min);
  }

  private static double minScore(List<RetrievalCandidate> candidates) {
    return candidates.stream().mapToDouble(RetrievalCandidate::score).min().orElse(0.0);
  }

  private static double maxScore(List<RetrievalCandidate> candidates) {
    return candidates.stream().mapToDouble(RetrievalCandidate::score).max().orElse(0.0);
  }

  private record FusedEntry(
      RetrievalCandidate candidate,
      @Nullable Double vectorScore,
      @Nullable Double textScore,
      double combinedScore,
      @Nullable Double normalisedTextScore) {

    RetrievalCandidate toCandidate(double textRelevanceFloor) {
      return candidate.withFusedScore(
          combinedScore, vectorScore, textScore, label(textRelevanceFloor));
    }

    private SearchType label(double textRelevanceFloor) {
      if (vectorScore != null && textScore != null) {
        return SearchType.HYBRID;
      }
      if (vectorScore == null
          && normalisedTextScore != null
          && normalisedTextScore >= textRelevanceFloor) {
        return SearchType.TEXT;
      }
      return SearchType.VECTOR;
    }
  }
}
