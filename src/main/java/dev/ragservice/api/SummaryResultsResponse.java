package dev.ragservice.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.ragservice.search.RetrievalSource;
import dev.ragservice.summary.DegradationReason;
import dev.ragservice.summary.SummaryResponse;
import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;

/**
 * JSON body returned by {@code POST /search-with-summary} and as the final streamed event.
 *
 * <p>{@code summary} always carries readable text: the generated summary, or a notice explaining
 * why it is missing while the results are still returned. {@code degraded_sources} names the
 * retrieval branches that were missing from the results the summary was built on.
 */
public record SummaryResultsResponse(
    List<SearchHitDto> results,
    String summary,
    @JsonProperty("summary_status") String summaryStatus,
    @JsonProperty("degradation_reason") @Nullable String degradationReason,
    @JsonProperty("latency_ms") double latencyMs,
    @JsonProperty("search_latency_ms") double searchLatencyMs,
    @JsonProperty("llm_latency_ms") double llmLatencyMs,
    @JsonProperty("degraded_sources") List<String> degradedSources) {

  static SummaryResultsResponse from(SummaryResponse response) {
    DegradationReason reason = response.degradationReason();
    String summary = response.summary();
    return new SummaryResultsResponse(
        SearchHitDto.fromAll(response.hits()),
        summary != null ? summary : notice(reason),
        response.status().name().toLowerCase(Locale.ROOT),
        reason == null ? null : reason.name().toLowerCase(Locale.ROOT),
        response.totalLatencyMs(),
        response.searchLatencyMs(),
        response.llmLatencyMs(),
        response.degradedSources().stream().map(RetrievalSource::label).sorted().toList());
  }

  private static String notice(@Nullable DegradationReason reason) {
    if (reason == null) {
      return "";
    }
    switch (reason) {
      case CIRCUIT_OPEN:
        return "Summary service is temporarily unavailable. "
            + "Search results are still available below.";
      case TIMEOUT:
        return "Summary generation timed out. Search results are still available below.";
      case CANCELLED:
        return "Summary generation was cancelled.";
      default:
        return "Summary generation failed. Search results are still available below.";
    }
  }
}
