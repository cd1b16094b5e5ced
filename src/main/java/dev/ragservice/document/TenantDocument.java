package dev.ragservice.document;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A document submitted for indexing on behalf of a tenant.
 *
 * @param tenantId the owning tenant (must not be blank)
 * @param documentId the tenant-local identifier; re-ingesting the same id replaces the document
 * @param content the text to embed and index (must not be blank)
 * @param metadata caller-supplied attributes returned with search hits; the keys {@code tenant_id}
 *     and {@code document_id} are reserved. Values must be strings or numbers, the types the
 *     embedding store's metadata can hold; booleans, arrays and objects are rejected rather than
 *     stored as their text form
 */
public record TenantDocument(
    String tenantId, String documentId, String content, Map<String, Object> metadata) {

  public TenantDocument {
    if (tenantId == null || tenantId.isBlank()) {
      throw new IllegalArgumentException("tenantId must not be blank");
    }
    if (documentId == null || documentId.isBlank()) {
      throw new IllegalArgumentException("documentId must not be blank");
    }
    if (content == null || content.isBlank()) {
      throw new IllegalArgumentException("content must not be blank");
    }
    metadata = metadata == null ? Map.of() : withoutNullValues(metadata);
    for (String reserved : TenantSegments.RESERVED_KEYS) {
      if (metadata.containsKey(reserved)) {
        throw new IllegalArgumentException("metadata key '" + reserved + "' is reserved");
      }
    }
    metadata.forEach(TenantDocument::requireScalar);
  }

  public TenantDocument(String tenantId, String documentId, String content) {
    this(tenantId, documentId, content, Map.of());
  }

  private static void requireScalar(String key, Object value) {
    if (!(value instanceof String || value instanceof Number || value instanceof UUID)) {
      throw new IllegalArgumentException(
          "metadata value for '"
              + key
              + "' must be a string or number, got "
              + value.getClass().getSimpleName());
    }
  }

  private static Map<String, Object> withoutNullValues(Map<String, Object> metadata) {
    Map<String, Object> copy = new LinkedHashMap<>();
    metadata.forEach(
        (key, value) -> {
          if (key != null && value != null) {
            copy.put(key, value);
          }
        });
    return Map.copyOf(copy);
  }
}
