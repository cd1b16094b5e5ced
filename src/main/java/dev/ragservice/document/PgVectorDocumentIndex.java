package dev.ragservice.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingStore;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * {@link DocumentIndex} backed by PostgreSQL with pgvector.
 *
 * <p>Dense retrieval goes through LangChain4j's {@code PgVectorEmbeddingStore} with a {@code
 * tenant_id} metadata filter. Sparse retrieval is a native full-text query over the same table,
 * also filtered on {@code tenant_id}. Both queries run on the {@link RetrievalPool}, whose
 * sessions carry a statement timeout, so an abandoned branch is cancelled by the server.
 *
 * <p>One document is stored as one row. A re-ingest replaces the row inside one transaction that
 * holds an advisory lock on the (tenant, document) pair: concurrent re-ingests of the same document
 * serialize, and readers see either the old row or the new one.
 */
@Component
@ConditionalOnProperty(name = "ragservice.index.type", havingValue = "pgvector", matchIfMissing = true)
public class PgVectorDocumentIndex implements DocumentIndex {

  private static final Logger log = LoggerFactory.getLogger(PgVectorDocumentIndex.class);

  private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

  /**
   * Full-text search over one tenant's documents, ranked by {@code ts_rank}. The {@code 'english'}
   * configuration must match the GIN index in the V1 migration.
   */
  static final String FULL_TEXT_SEARCH =
      """
      SELECT metadata->>'document_id' AS document_id,
             text,
             CAST(metadata AS text) AS metadata,
             ts_rank(to_tsvector('english', text), plainto_tsquery('english', :query)) AS score
      FROM document_chunks
      WHERE metadata->>'tenant_id' = :tenantId
        AND to_tsvector('english', text) @@ plainto_tsquery('english', :query)
      ORDER BY score DESC, document_id
      LIMIT :limit
      """;

  /** Transaction-scoped lock keyed on the (tenant, document) pair. */
  static final String DOCUMENT_LOCK = "SELECT pg_advisory_xact_lock(hashtext(?))";

  private final EmbeddingStore<TextSegment> embeddingStore;
  private final EmbeddingStore<TextSegment> retrievalStore;
  private final NamedParameterJdbcTemplate retrievalJdbc;
  private final JdbcTemplate jdbcTemplate;
  private final TransactionTemplate transactionTemplate;
  private final DocumentChunkRepository documentChunkRepository;
  private final ObjectMapper objectMapper;

  public PgVectorDocumentIndex(
      EmbeddingStore<TextSegment> embeddingStore,
      @Qualifier("retrievalEmbeddingStore") EmbeddingStore<TextSegment> retrievalStore,
      RetrievalPool retrievalPool,
      JdbcTemplate jdbcTemplate,
      PlatformTransactionManager transactionManager,
      DocumentChunkRepository documentChunkRepository,
      ObjectMapper objectMapper) {
    this.embeddingStore = embeddingStore;
    this.retrievalStore = retrievalStore;
    this.retrievalJdbc = new NamedParameterJdbcTemplate(retrievalPool.dataSource());
    this.jdbcTemplate = jdbcTemplate;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.documentChunkRepository = documentChunkRepository;
    this.objectMapper = objectMapper;
  }

  @Override
  public List<IndexMatch> queryDense(String tenantId, Embedding queryEmbedding, int limit) {
    return TenantSegments.denseSearch(retrievalStore, tenantId, queryEmbedding, limit);
  }

  @Override
  public List<IndexMatch> querySparse(String tenantId, String queryText, int limit) {
    MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("query", queryText)
            .addValue("limit", limit);
    return retrievalJdbc.query(FULL_TEXT_SEARCH, params, (rs, rowNum) -> toMatch(rs));
  }

  @Override
  public void upsert(TenantDocument document, Embedding embedding) {
    String id =
        transactionTemplate.execute(
            status -> {
              jdbcTemplate.query(
                  DOCUMENT_LOCK,
                  (RowCallbackHandler) rs -> {},
                  document.tenantId() + "/" + document.documentId());
              embeddingStore.removeAll(
                  TenantSegments.documentFilter(document.tenantId(), document.documentId()));
              return embeddingStore.add(embedding, TenantSegments.toSegment(document));
            });
    log.debug(
        "Stored document {} for tenant {} as {}", document.documentId(), document.tenantId(), id);
  }

  @Override
  public int deleteTenant(String tenantId) {
    return documentChunkRepository.deleteByTenant(tenantId);
  }

  @Override
  public boolean isReachable() {
    try {
      documentChunkRepository.count();
      return true;
    } catch (DataAccessException e) {
      log.warn("Document index unreachable: {}", e.getMessage());
      return false;
    }
  }

  private IndexMatch toMatch(ResultSet rs) throws SQLException {
    return new IndexMatch(
        rs.getString("document_id"),
        rs.getDouble("score"),
        rs.getString("text"),
        userMetadata(rs.getString("metadata")));
  }

  private Map<String, Object> userMetadata(String json) {
    if (json == null || json.isBlank()) {
      return Map.of();
    }
    try {
      Map<String, Object> metadata = new LinkedHashMap<>(objectMapper.readValue(json, METADATA_TYPE));
      TenantSegments.RESERVED_KEYS.forEach(metadata::remove);
      metadata.values().removeIf(value -> value == null);
      return metadata;
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unreadable metadata JSON in document_chunks", e);
    }
  }
}
