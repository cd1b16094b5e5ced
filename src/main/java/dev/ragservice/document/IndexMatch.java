package dev.ragservice.document;

import java.util.Map;

/**
 * One row returned by a {@link DocumentIndex} query, in the index's own relevance order.
 *
 * @param documentId the tenant-local document identifier
 * @param score the index's score (cosine relevance for dense, keyword rank for sparse)
 * @param content the stored document text
 * @param metadata the caller-supplied metadata, without reserved keys
 */
public record IndexMatch(
    String documentId, double score, String content, Map<String, Object> metadata) {

  public IndexMatch {
    metadata = Map.copyOf(metadata);
  }
}
