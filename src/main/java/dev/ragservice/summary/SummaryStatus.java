package dev.ragservice.summary;

/** How the summary part of a search-with-summary response ended. */
public enum SummaryStatus {

  /** The generator finished within its budget. */
  COMPLETE,

  /** Output started but was cut short; the partial text is kept. */
  INCOMPLETE,

  /** No summary was produced; only search results are returned. */
  DEGRADED,

  /** Generation was not attempted because the search returned nothing. */
  SKIPPED
}
