package dev.ragservice.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.ragservice.search.RetrievalSource;
import dev.ragservice.search.SearchResponse;
import java.util.List;

/** JSON body returned by {@code POST /search}. */
public record SearchResultsResponse(
    List<SearchHitDto> results,
    @JsonProperty("latency_ms") double latencyMs,
    @JsonProperty("degraded_sources") List<String> degradedSources) {

  static SearchResultsResponse from(SearchResponse response) {
    return new SearchResultsResponse(
        SearchHitDto.fromAll(response.hits()),
        response.latencyMs(),
        response.degradedSources().stream().map(RetrievalSource::label).toList());
  }
}
