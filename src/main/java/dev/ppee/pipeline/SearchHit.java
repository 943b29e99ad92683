package dev.ppee.pipeline;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.ppee.search.RetrievalCandidate;
import dev.ppee.search.SearchType;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.jspecify.annotations.Nullable;

/** A search result as shown to clients, scores rounded to four decimals. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SearchHit(
    int position,
    String chunkId,
    String documentId,
    @Nullable Integer pageNumber,
    String section,
    String contentType,
    String text,
    double score,
    @Nullable Double vectorScore,
    @Nullable Double textScore,
    @Nullable Double rerankScore,
    SearchType searchType) {

  static SearchHit from(int position, RetrievalCandidate candidate) {
    return new SearchHit(
        position,
        candidate.chunkId(),
        candidate.documentId(),
        candidate.pageNumber(),
        candidate.section(),
        candidate.contentType(),
        candidate.text(),
        round(candidate.score()),
        roundNullable(candidate.vectorScore()),
        roundNullable(candidate.textScore()),
        roundNullable(candidate.rerankScore()),
        candidate.searchType());
  }

  static double round(double value) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      return value;
    }
    return BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_UP).doubleValue();
  }

  private static @Nullable Double roundNullable(@Nullable Double value) {
    return value == null ? null : round(value);
  }
}
