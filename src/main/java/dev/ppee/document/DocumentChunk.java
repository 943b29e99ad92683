package dev.ppee.document;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * A single indexed chunk of an application document stored in pgvector.
 *
 * <p>Each chunk holds the text content and JSONB metadata ({@code application_id}, {@code
 * document_id}, {@code page_number}, {@code section}, {@code content_type}, {@code chunk_index}).
 * Chunks are written by the external indexer through LangChain4j's {@code PgVectorEmbeddingStore};
 * this service only reads them, so the entity is immutable and the embedding vector is not mapped.
 *
 * <p>Maps to the {@code document_chunks} table managed by Flyway migrations.
 *
 * @see DocumentChunkRepository
 */
@Entity
@Immutable
@Table(name = "document_chunks")
public class DocumentChunk {

  @Id
  @Column(name = "embedding_id")
  private UUID id;

  @Column(nullable = false, columnDefinition = "TEXT")
  private String text;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(columnDefinition = "JSONB")
  private String metadata;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected DocumentChunk() {
    // JPA requires no-arg constructor
  }

  public UUID getId() {
    return id;
  }

  public String getText() {
    return text;
  }

  public String getMetadata() {
    return metadata;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
