package dev.ragservice.summary;

import dev.ragservice.search.SearchResponse;

/**
 * Receives a search-with-summary response incrementally, as it is produced.
 *
 * <p>Callbacks run on the thread executing the pipeline. A sink reporting {@link #isCancelled()}
 * makes the pipeline stop reading and close the generation stream.
 */
public interface SummarySink {

  /** Sink that ignores everything, for callers that only want the final response. */
  SummarySink NONE = fragment -> {};

  /** Called once, before generation starts. */
  default void onSearchComplete(SearchResponse response) {}

  /** Called for every generated fragment, in order. */
  void onFragment(String fragment);

  /** Whether the receiver has gone away. */
  default boolean isCancelled() {
    return false;
  }
}
