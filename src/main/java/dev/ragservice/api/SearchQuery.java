package dev.ragservice.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.ragservice.search.SearchRequest;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.jspecify.annotations.Nullable;

/**
 * JSON body of the search endpoints.
 *
 * @param tenantId the tenant to search
 * @param query the query text
 * @param topK number of results, defaults to {@value SearchRequest#DEFAULT_TOP_K}
 */
public record SearchQuery(
    @NotBlank @JsonProperty("tenant_id") String tenantId,
    @NotBlank String query,
    @Nullable @Min(1) @Max(SearchRequest.MAX_TOP_K) @JsonProperty("top_k") Integer topK) {

  SearchRequest toSearchRequest() {
    return new SearchRequest(tenantId, query, topK == null ? SearchRequest.DEFAULT_TOP_K : topK);
  }
}
