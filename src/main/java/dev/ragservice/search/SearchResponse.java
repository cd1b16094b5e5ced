package dev.ragservice.search;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Result of a hybrid search.
 *
 * @param hits at most {@code topK} fused results, best first
 * @param latencyMs wall-clock time of the search
 * @param degradedSources retrieval branches that timed out, were rejected by an open breaker, or
 *     failed and contributed nothing
 */
public record SearchResponse(
    List<SearchHit> hits, double latencyMs, Set<RetrievalSource> degradedSources) {

  public SearchResponse {
    hits = List.copyOf(hits);
    degradedSources =
        degradedSources.isEmpty()
            ? Set.of()
            : Collections.unmodifiableSet(EnumSet.copyOf(degradedSources));
  }

  /** Whether one retrieval branch was missing from the fusion. */
  public boolean isPartial() {
    return !degradedSources.isEmpty();
  }
}
