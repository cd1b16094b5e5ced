package dev.ragservice.document;

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
 * Read-only view of one indexed document row in pgvector.
 *
 * <p>Rows are written by LangChain4j's {@code PgVectorEmbeddingStore}; the embedding vector is not
 * mapped here. The JSONB metadata carries {@code tenant_id} and {@code document_id} next to the
 * caller's own attributes.
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

  @Column(columnDefinition = "TEXT")
  private String text;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(columnDefinition = "JSONB")
  private String metadata;

  @Column(name = "created_at", insertable = false, updatable = false)
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
