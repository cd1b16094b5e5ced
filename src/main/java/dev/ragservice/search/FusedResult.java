package dev.ragservice.search;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * A document after Reciprocal Rank Fusion.
 *
 * @param documentId the document identifier
 * @param fusedScore sum of {@code 1 / (k + rank)} over the lists containing the document
 * @param sources the lists the document appeared in
 */
public record FusedResult(String documentId, double fusedScore, Set<RetrievalSource> sources) {

  public FusedResult {
    sources =
        sources.isEmpty() ? Set.of() : Collections.unmodifiableSet(EnumSet.copyOf(sources));
  }
}
