package dev.ragservice.search;

import org.jspecify.annotations.Nullable;

/**
 * One entry of a ranked retrieval list.
 *
 * @param documentId the tenant-local document identifier
 * @param rank 1-based position within its source list
 * @param source which retrieval produced the list
 * @param rawScore the retriever's own score, informational only
 */
public record RankedHit(
    String documentId, int rank, RetrievalSource source, @Nullable Double rawScore) {

  public RankedHit {
    if (documentId == null || documentId.isBlank()) {
      throw new IllegalArgumentException("documentId must not be blank");
    }
    if (rank < 1) {
      throw new IllegalArgumentException("rank must be at least 1, got: " + rank);
    }
    if (source == null) {
      throw new IllegalArgumentException("source must not be null");
    }
  }

  public RankedHit(String documentId, int rank, RetrievalSource source) {
    this(documentId, rank, source, null);
  }
}
