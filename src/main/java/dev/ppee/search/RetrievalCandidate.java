package dev.ppee.search;

import java.util.Comparator;
import org.jspecify.annotations.Nullable;

/**
 * A single chunk returned by retrieval, carrying every score it picked up along the way.
 *
 * @param chunkId the chunk's embedding id in the vector store
 * @param documentId the document the chunk was cut from
 * @param pageNumber source page, if the indexer recorded one
 * @param section section heading or path, empty when unknown
 * @param text chunk text
 * @param contentType chunk content type as recorded by the indexer (text, table, ...)
 * @param chunkIndex position of the chunk inside its document, if known
 * @param score blended retrieval score (vector similarity or fused hybrid score)
 * @param vectorScore raw vector similarity, null for text-only candidates
 * @param textScore raw lexical rank, null for vector-only candidates
 * @param rerankScore cross-encoder score, null until reranked
 * @param searchType which source produced the candidate
 */
public record RetrievalCandidate(
    String chunkId,
    String documentId,
    @Nullable Integer pageNumber,
    String section,
    String text,
    String contentType,
    @Nullable Integer chunkIndex,
    double score,
    @Nullable Double vectorScore,
    @Nullable Double textScore,
    @Nullable Double rerankScore,
    SearchType searchType) {

  /** Orders candidates by effective score, highest first. */
  public static final Comparator<RetrievalCandidate> BY_EFFECTIVE_SCORE =
      Comparator.comparingDouble(RetrievalCandidate::effectiveScore).reversed();

  public RetrievalCandidate {
    section = section == null ? "" : section;
    contentType = contentType == null ? "" : contentType;
    documentId = documentId == null ? "" : documentId;
  }

  /** The reranker score when present, otherwise the retrieval score. */
  public double effectiveScore() {
    return rerankScore != null ? rerankScore : score;
  }

  public RetrievalCandidate withRerankScore(@Nullable Double newRerankScore) {
    return new RetrievalCandidate(
        chunkId,
        documentId,
        pageNumber,
        section,
        text,
        contentType,
        chunkIndex,
        score,
        vectorScore,
        textScore,
        newRerankScore,
        searchType);
  }

  public RetrievalCandidate withFusedScore(
      double fusedScore,
      @Nullable Double newVectorScore,
      @Nullable Double newTextScore,
      SearchType newSearchType) {
    return new RetrievalCandidate(
        chunkId,
        documentId,
        pageNumber,
        section,
        text,
        contentType,
        chunkIndex,
        fusedScore,
        newVectorScore,
        newTextScore,
        rerankScore,
        newSearchType);
  }
}
