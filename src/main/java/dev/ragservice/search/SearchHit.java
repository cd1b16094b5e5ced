package dev.ragservice.search;

import java.util.Map;
import java.util.Set;

/**
 * A fused search result with its content attached.
 *
 * @param documentId the tenant-local document identifier
 * @param content the document text
 * @param score the fused RRF score
 * @param metadata the metadata stored with the document at ingestion
 * @param sources the retrieval lists the document appeared in
 */
public record SearchHit(
    String documentId,
    String content,
    double score,
    Map<String, Object> metadata,
    Set<RetrievalSource> sources) {

  public SearchHit {
    metadata = Map.copyOf(metadata);
  }
}
