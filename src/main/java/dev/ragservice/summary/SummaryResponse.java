package dev.ragservice.summary;

import dev.ragservice.search.RetrievalSource;
import dev.ragservice.search.SearchHit;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Search results plus a generated summary, or an explicit marker of why the summary is missing.
 *
 * @param hits the fused search hits; always present
 * @param degradedSources retrieval branches missing from {@code hits}, empty for a full search
 * @param summary the generated text (possibly partial), or {@code null} when degraded
 * @param status how generation ended
 * @param degradationReason why generation was degraded or cut short, {@code null} otherwise
 * @param searchLatencyMs time spent in search
 * @param llmLatencyMs time spent in generation, 0 when it was not attempted
 * @param totalLatencyMs end-to-end time
 */
public record SummaryResponse(
    List<SearchHit> hits,
    Set<RetrievalSource> degradedSources,
    @Nullable String summary,
    SummaryStatus status,
    @Nullable DegradationReason degradationReason,
    double searchLatencyMs,
    double llmLatencyMs,
    double totalLatencyMs) {

  public SummaryResponse {
    hits = List.copyOf(hits);
    degradedSources = Set.copyOf(degradedSources);
  }

  public boolean isDegraded() {
    return status == SummaryStatus.DEGRADED;
  }
}
