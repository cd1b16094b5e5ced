package dev.ragservice.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.ragservice.search.RetrievalSource;
import dev.ragservice.search.SearchHit;
import java.util.List;
import java.util.Map;

/** One search result as rendered in JSON. */
public record SearchHitDto(
    @JsonProperty("document_id") String documentId,
    String content,
    double score,
    Map<String, Object> metadata,
    List<String> sources) {

  static SearchHitDto from(SearchHit hit) {
    return new SearchHitDto(
        hit.documentId(),
        hit.content(),
        hit.score(),
        hit.metadata(),
        hit.sources().stream().map(RetrievalSource::label).toList());
  }

  static List<SearchHitDto> fromAll(List<SearchHit> hits) {
    return hits.stream().map(SearchHitDto::from).toList();
  }
}
