package dev.ragservice.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * JSON body returned by {@code GET /health}.
 *
 * @param status {@code healthy} or {@code degraded}
 * @param indexReachable whether the document index answered
 * @param embeddingModelLoaded whether the embedding model produced a vector
 * @param breakers state of each circuit breaker by dependency name
 */
public record HealthResponse(
    String status,
    @JsonProperty("index_reachable") boolean indexReachable,
    @JsonProperty("embedding_model_loaded") boolean embeddingModelLoaded,
    Map<String, BreakerStatus> breakers) {

  /** Breaker details for operators. */
  public record BreakerStatus(
      String state,
      @JsonProperty("consecutive_failures") int consecutiveFailures,
      @JsonProperty("last_transition") String lastTransition) {}
}
