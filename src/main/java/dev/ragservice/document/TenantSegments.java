package dev.ragservice.document;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.filter.Filter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Mapping between {@link TenantDocument}s and LangChain4j {@link TextSegment}s.
 *
 * <p>The tenant and document ids travel as segment metadata ({@code tenant_id}, {@code
 * document_id}); every store query is filtered on {@code tenant_id}.
 */
final class TenantSegments {

  static final String TENANT_ID = "tenant_id";
  static final String DOCUMENT_ID = "document_id";
  static final List<String> RESERVED_KEYS = List.of(TENANT_ID, DOCUMENT_ID);

  private TenantSegments() {}

  static Filter tenantFilter(String tenantId) {
    return metadataKey(TENANT_ID).isEqualTo(tenantId);
  }

  static Filter documentFilter(String tenantId, String documentId) {
    return tenantFilter(tenantId).and(metadataKey(DOCUMENT_ID).isEqualTo(documentId));
  }

  static TextSegment toSegment(TenantDocument document) {
    Map<String, Object> values = new LinkedHashMap<>();
    document.metadata().forEach((key, value) -> values.put(key, toMetadataValue(value)));
    values.put(TENANT_ID, document.tenantId());
    values.put(DOCUMENT_ID, document.documentId());
    return TextSegment.from(document.content(), Metadata.from(values));
  }

  static IndexMatch toMatch(EmbeddingMatch<TextSegment> match) {
    TextSegment segment = match.embedded();
    Map<String, Object> metadata = new LinkedHashMap<>(segment.metadata().toMap());
    String documentId = String.valueOf(metadata.remove(DOCUMENT_ID));
    metadata.remove(TENANT_ID);
    return new IndexMatch(documentId, match.score(), segment.text(), metadata);
  }

  static List<IndexMatch> denseSearch(
      EmbeddingStore<TextSegment> store, String tenantId, Embedding queryEmbedding, int limit) {
    EmbeddingSearchRequest request =
        EmbeddingSearchRequest.builder()
            .queryEmbedding(queryEmbedding)
            .maxResults(limit)
            .filter(tenantFilter(tenantId))
            .build();
    return store.search(request).matches().stream().map(TenantSegments::toMatch).toList();
  }

  /**
   * Narrows a metadata value to the types LangChain4j metadata accepts. {@link TenantDocument}
   * admits only strings, numbers and UUIDs; numbers other than int, long, float and double are
   * stored as double.
   */
  static Object toMetadataValue(Object value) {
    if (value instanceof String
        || value instanceof Integer
        || value instanceof Long
        || value instanceof Float
        || value instanceof Double
        || value instanceof UUID) {
      return value;
    }
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    throw new IllegalArgumentException(
        "unsupported metadata value type: " + value.getClass().getSimpleName());
  }
}
