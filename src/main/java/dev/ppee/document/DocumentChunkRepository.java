package dev.ppee.document;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Spring Data repository for {@link DocumentChunk} entities.
 *
 * <p>Row-returning queries share one column layout, see {@link ChunkRowColumns}.
 */
public interface DocumentChunkRepository extends JpaRepository<DocumentChunk, UUID> {

  /**
   * Lexical search over one application's chunks using PostgreSQL full-text search.
   *
   * @param applicationId the application whose chunks are searched
   * @param query the raw user query, parsed with {@code plainto_tsquery}
   * @param textSearchConfig the text search configuration, e.g. {@code russian}
   * @param limit maximum number of rows
   * @return rows in {@link ChunkRowColumns} layout, best {@code ts_rank_cd} first
   */
  @Query(
      value =
          """
            SELECT CAST(embedding_id AS text), text,
                   metadata->>'document_id', metadata->>'page_number', metadata->>'section',
                   metadata->>'content_type', metadata->>'chunk_index',
                   ts_rank_cd(to_tsvector(CAST(:textSearchConfig AS regconfig), text),
                              plainto_tsquery(CAST(:textSearchConfig AS regconfig), :query)) AS rank
            FROM document_chunks
            WHERE metadata->>'application_id' = :applicationId
              AND to_tsvector(CAST(:textSearchConfig AS regconfig), text)
                  @@ plainto_tsquery(CAST(:textSearchConfig AS regconfig), :query)
            ORDER BY rank DESC, created_at
            LIMIT :limit
            """,
      nativeQuery = true)
  List<Object[]> fullTextSearch(
      @Param("applicationId") String applicationId,
      @Param("query") String query,
      @Param("textSearchConfig") String textSearchConfig,
      @Param("limit") int limit);

  /**
   * Returns every chunk of an application in document order. Chunk indexes stored as strings
   * ({@code "3"}, {@code "3.0"}) sort numerically; non-numeric ones sort last.
   *
   * @param applicationId the application to scan
   * @return rows in {@link ChunkRowColumns} layout with a constant rank of 0
   */
  @Query(
      value =
          """
            SELECT CAST(embedding_id AS text), text,
                   metadata->>'document_id', metadata->>'page_number', metadata->>'section',
                   metadata->>'content_type', metadata->>'chunk_index',
                   0.0 AS rank
            FROM document_chunks
            WHERE metadata->>'application_id' = :applicationId
            ORDER BY metadata->>'document_id',
                     CASE WHEN metadata->>'chunk_index' ~ '^\\s*[0-9]+(\\.[0-9]+){0,1}\\s*$'
                          THEN CAST(metadata->>'chunk_index' AS numeric) END NULLS LAST,
                     created_at
            """,
      nativeQuery = true)
  List<Object[]> findAllByApplicationId(@Param("applicationId") String applicationId);

  /**
   * Counts the chunks of an application.
   *
   * @param applicationId the application
   * @return total chunk count
   */
  @Query(
      value =
          """
            SELECT COUNT(*) FROM document_chunks WHERE metadata->>'application_id' = :applicationId
            """,
      nativeQuery = true)
  long countByApplicationId(@Param("applicationId") String applicationId);
}
