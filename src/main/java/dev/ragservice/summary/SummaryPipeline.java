package dev.ragservice.summary;

import dev.ragservice.resilience.CircuitBreaker;
import dev.ragservice.resilience.CircuitBreakerRegistry;
import dev.ragservice.resilience.Deadline;
import dev.ragservice.resilience.DeadlineGuard;
import dev.ragservice.search.RetrievalFailureException;
import dev.ragservice.search.SearchOrchestrator;
import dev.ragservice.search.SearchRequest;
import dev.ragservice.search.SearchResponse;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Search followed by a streamed summary of the top hits.
 *
 * <p>Search is the guaranteed part: its failure propagates, while every generation problem is
 * absorbed. Generation runs through the generation circuit breaker and its own budget. If the
 * breaker is open, or the budget expires or the backend fails before any output, the response
 * carries the search hits with {@link SummaryStatus#DEGRADED}. If output had already started, the
 * partial text is kept and marked {@link SummaryStatus#INCOMPLETE}; fragments already handed to
 * the {@link SummarySink} are never retracted.
 */
@Service
public class SummaryPipeline {

  private static final Logger log = LoggerFactory.getLogger(SummaryPipeline.class);

  static final String NO_RESULTS_SUMMARY = "No results found for your query.";

  private final SearchOrchestrator searchOrchestrator;
  private final SummaryGenerator summaryGenerator;
  private final SummaryPromptBuilder promptBuilder;
  private final CircuitBreakerRegistry breakers;
  private final DeadlineGuard deadlineGuard;
  private final SummaryProperties properties;

  public SummaryPipeline(
      SearchOrchestrator searchOrchestrator,
      SummaryGenerator summaryGenerator,
      SummaryPromptBuilder promptBuilder,
      CircuitBreakerRegistry breakers,
      DeadlineGuard deadlineGuard,
      SummaryProperties properties) {
    this.searchOrchestrator = searchOrchestrator;
    this.summaryGenerator = summaryGenerator;
    this.promptBuilder = promptBuilder;
    this.breakers = breakers;
    this.deadlineGuard = deadlineGuard;
    this.properties = properties;
  }

  /** Runs search-with-summary and returns only the final response. */
  public SummaryResponse searchWithSummary(SearchRequest request) {
    return searchWithSummary(request, SummarySink.NONE);
  }

  /**
   * Runs search-with-summary, pushing the search response and every generated fragment to {@code
   * sink} as they become available.
   *
   * @param request the search request
   * @param sink receiver of incremental output
   * @return the hits, the summary text and how generation ended
   * @throws RetrievalFailureException if the search itself failed
   */
  public SummaryResponse searchWithSummary(SearchRequest request, SummarySink sink) {
    long start = System.nanoTime();
    SearchResponse search = searchOrchestrator.search(request);
    sink.onSearchComplete(search);

    if (search.hits().isEmpty()) {
      return new SummaryResponse(
          search.hits(),
          search.degradedSources(),
          NO_RESULTS_SUMMARY,
          SummaryStatus.SKIPPED,
          null,
          search.latencyMs(),
          0.0,
          millisSince(start));
    }

    String prompt = promptBuilder.build(request.query(), search.hits());
    Generation generation = generate(prompt, sink);
    double totalMs = millisSince(start);

    log.info(
        "Summary tenant={} status={} reason={} chars={} search={}ms llm={}ms total={}ms",
        request.tenantId(),
        generation.status(),
        generation.reason(),
        generation.text() == null ? 0 : generation.text().length(),
        Math.round(search.latencyMs()),
        Math.round(generation.elapsedMs()),
        Math.round(totalMs));

    return new SummaryResponse(
        search.hits(),
        search.degradedSources(),
        generation.text(),
        generation.status(),
        generation.reason(),
        search.latencyMs(),
        generation.elapsedMs(),
        totalMs);
  }

  private Generation generate(String prompt, SummarySink sink) {
    long start = System.nanoTime();
    Optional<CircuitBreaker.Permit> acquired = breakers.generation().tryAcquire();
    if (acquired.isEmpty()) {
      log.warn("Summary degraded: generation circuit open");
      return Generation.degraded(DegradationReason.CIRCUIT_OPEN, start);
    }
    CircuitBreaker.Permit permit = acquired.get();
    Deadline deadline = deadlineGuard.deadline(properties.getBudget());

    GenerationStream stream;
    try {
      stream = summaryGenerator.generate(prompt);
    } catch (RuntimeException e) {
      permit.recordFailure(e);
      log.warn("Summary degraded: generator rejected the request: {}", e.getMessage());
      return Generation.degraded(DegradationReason.GENERATION_FAILED, start);
    }

    StringBuilder text = new StringBuilder();
    try (GenerationStream fragments = stream) {
      while (true) {
        if (sink.isCancelled()) {
          permit.release();
          log.info("Summary stream cancelled by client after {} chars", text.length());
          return Generation.cutShort(text, DegradationReason.CANCELLED, start);
        }
        if (deadline.isExpired()) {
          throw new TimeoutException("Generation budget of " + properties.getBudget() + " spent");
        }
        Optional<String> fragment = fragments.next(deadline.remaining());
        if (fragment.isEmpty()) {
          permit.recordSuccess();
          return Generation.complete(text, start);
        }
        text.append(fragment.get());
        sink.onFragment(fragment.get());
      }
    } catch (TimeoutException e) {
      permit.recordFailure(e);
      log.warn("Summary cut short by deadline after {} chars", text.length());
      return Generation.cutShort(text, DegradationReason.TIMEOUT, start);
    } catch (GenerationException e) {
      permit.recordFailure(e);
      log.warn("Summary generation failed after {} chars: {}", text.length(), describe(e));
      return Generation.cutShort(text, DegradationReason.GENERATION_FAILED, start);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      permit.release();
      return Generation.cutShort(text, DegradationReason.CANCELLED, start);
    } catch (RuntimeException e) {
      permit.release();
      throw e;
    }
  }

  private static String describe(GenerationException e) {
    Throwable cause = e.getCause();
    return cause == null
        ? e.getMessage()
        : cause.getClass().getSimpleName() + ": " + cause.getMessage();
  }

  private static double millisSince(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000.0;
  }

  private record Generation(
      @Nullable String text,
      SummaryStatus status,
      @Nullable DegradationReason reason,
      double elapsedMs) {

    static Generation complete(StringBuilder text, long startNanos) {
      return new Generation(
          text.toString().strip(), SummaryStatus.COMPLETE, null, millisSince(startNanos));
    }

    static Generation degraded(DegradationReason reason, long startNanos) {
      return new Generation(null, SummaryStatus.DEGRADED, reason, millisSince(startNanos));
    }

    /** Degraded if nothing was produced yet, otherwise incomplete with the partial text. */
    static Generation cutShort(StringBuilder text, DegradationReason reason, long startNanos) {
      if (text.length() == 0) {
        return degraded(reason, startNanos);
      }
      return new Generation(
          text.toString(), SummaryStatus.INCOMPLETE, reason, millisSince(startNanos));
    }
  }
}
