package dev.ragservice.document;

import dev.langchain4j.data.embedding.Embedding;
import java.util.List;

/**
 * Tenant-partitioned document index offering dense (embedding) and sparse (keyword) retrieval.
 *
 * <p>Every query is restricted to the given tenant; implementations never return another tenant's
 * documents. Query methods must respond to thread interruption so that an expired deadline can
 * abandon them.
 */
public interface DocumentIndex {

  /**
   * Embedding similarity search.
   *
   * @param tenantId the tenant whose documents are searched
   * @param queryEmbedding the embedded query
   * @param limit maximum number of matches
   * @return matches ordered by similarity, best first
   */
  List<IndexMatch> queryDense(String tenantId, Embedding queryEmbedding, int limit);

  /**
   * Keyword search.
   *
   * @param tenantId the tenant whose documents are searched
   * @param queryText the raw query text
   * @param limit maximum number of matches
   * @return matches ordered by keyword relevance, best first; documents sharing no term with the
   *     query are not returned
   */
  List<IndexMatch> querySparse(String tenantId, String queryText, int limit);

  /** Stores the document, replacing any earlier version with the same tenant and document id. */
  void upsert(TenantDocument document, Embedding embedding);

  /**
   * Removes every document of a tenant.
   *
   * @return the number of documents removed
   */
  int deleteTenant(String tenantId);

  /** Whether the backing store currently answers queries. */
  boolean isReachable();
}
