package dev.ragservice.search;

/**
 * Domain request for a tenant-scoped hybrid search.
 *
 * @param tenantId the tenant whose documents are searched (must not be blank); passed unchanged to
 *     every retrieval call
 * @param query the search query text (must not be blank)
 * @param topK the number of fused results to return, in [1, 100]
 */
public record SearchRequest(String tenantId, String query, int topK) {

  /** Default number of results when not specified. */
  public static final int DEFAULT_TOP_K = 5;

  /** Largest accepted {@code topK}. */
  public static final int MAX_TOP_K = 100;

  /** Compact constructor validating input. */
  public SearchRequest {
    if (tenantId == null || tenantId.isBlank()) {
      throw new IllegalArgumentException("tenantId must not be blank");
    }
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("Query must not be blank");
    }
    if (topK < 1 || topK > MAX_TOP_K) {
      throw new IllegalArgumentException("topK must be in [1, " + MAX_TOP_K + "], got: " + topK);
    }
  }

  /** Convenience constructor defaulting topK to 5. */
  public SearchRequest(String tenantId, String query) {
    this(tenantId, query, DEFAULT_TOP_K);
  }
}
