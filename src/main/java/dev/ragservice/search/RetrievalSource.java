package dev.ragservice.search;

/** The retrieval method that produced a ranked list. */
public enum RetrievalSource {

  /** Embedding similarity search. */
  DENSE("dense"),

  /** Keyword (full-text) search. */
  SPARSE("sparse");

  private final String label;

  RetrievalSource(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
