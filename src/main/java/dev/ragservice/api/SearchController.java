package dev.ragservice.api;

import dev.ragservice.search.RetrievalFailureException;
import dev.ragservice.search.SearchOrchestrator;
import dev.ragservice.search.SearchRequest;
import dev.ragservice.summary.SummaryPipeline;
import dev.ragservice.summary.SummaryResponse;
import jakarta.validation.Valid;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Search endpoints: plain hybrid search, search with a buffered summary, and search with a summary
 * streamed as server-sent events.
 */
@RestController
public class SearchController {

  private static final Logger log = LoggerFactory.getLogger(SearchController.class);

  /** Upper bound for an open event stream; the pipeline itself finishes well within it. */
  static final long STREAM_TIMEOUT_MS = 30_000L;

  private final SearchOrchestrator searchOrchestrator;
  private final SummaryPipeline summaryPipeline;
  private final ExecutorService streamingExecutor;

  public SearchController(
      SearchOrchestrator searchOrchestrator,
      SummaryPipeline summaryPipeline,
      @Qualifier("streamingExecutor") ExecutorService streamingExecutor) {
    this.searchOrchestrator = searchOrchestrator;
    this.summaryPipeline = summaryPipeline;
    this.streamingExecutor = streamingExecutor;
  }

  @PostMapping("/search")
  public SearchResultsResponse search(@Valid @RequestBody SearchQuery query) {
    return SearchResultsResponse.from(searchOrchestrator.search(query.toSearchRequest()));
  }

  @PostMapping("/search-with-summary")
  public SummaryResultsResponse searchWithSummary(@Valid @RequestBody SearchQuery query) {
    return SummaryResultsResponse.from(summaryPipeline.searchWithSummary(query.toSearchRequest()));
  }

  /**
   * Streams a search-with-summary as events: {@code results} once, {@code token} per generated
   * fragment, then {@code summary} with the final response. If the search fails an {@code error}
   * event is sent instead. Closing the connection stops generation.
   */
  @PostMapping(path = "/search-with-summary/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public SseEmitter streamSearchWithSummary(@Valid @RequestBody SearchQuery query) {
    SearchRequest request = query.toSearchRequest();
    SseEmitter emitter = new SseEmitter(STREAM_TIMEOUT_MS);
    SseSummarySink sink = new SseSummarySink(emitter);
    emitter.onCompletion(sink::cancel);
    emitter.onTimeout(sink::cancel);
    emitter.onError(error -> sink.cancel());

    try {
      streamingExecutor.execute(() -> stream(request, sink, emitter));
    } catch (RejectedExecutionException e) {
      throw new ResponseStatusException(
          HttpStatus.SERVICE_UNAVAILABLE, "Too many open summary streams", e);
    }
    return emitter;
  }

  private void stream(SearchRequest request, SseSummarySink sink, SseEmitter emitter) {
    try {
      SummaryResponse response = summaryPipeline.searchWithSummary(request, sink);
      sink.send("summary", SummaryResultsResponse.from(response));
      emitter.complete();
    } catch (RetrievalFailureException e) {
      sink.send(
          "error",
          Map.of(
              "detail", "Search is temporarily unavailable", "branches", e.getBranchFailures()));
      emitter.complete();
    } catch (RuntimeException e) {
      log.error("Summary stream for tenant {} failed", request.tenantId(), e);
      emitter.completeWithError(e);
    }
  }
}
