package dev.ragservice.search;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pure static utility fusing ranked lists with Reciprocal Rank Fusion.
 *
 * <p>Each document scores {@code sum(1 / (k + rank))} over the lists it appears in; a list that does
 * not contain the document contributes nothing. Only ranks are used, so lists with incomparable
 * score scales (cosine similarity, full-text rank) can be combined directly.
 *
 * <p>Results are ordered by fused score descending. Ties are broken by:
 *
 * <ol>
 *   <li>the number of lists the document appeared in, more first
 *   <li>its dense rank, lower first (documents without a dense rank come after those with one)
 *   <li>its document id, lexicographically
 * </ol>
 *
 * <p>The contributions of one document are summed in ascending order, so the result does not
 * depend on the order in which the lists are passed. A document listed twice in the same list
 * counts once, at its best rank.
 *
 * <p>This class has no Spring dependencies and no state.
 */
public final class ReciprocalRankFusion {

  /** Rank damping constant from the original RRF paper. */
  public static final int DEFAULT_K = 60;

  private static final Comparator<FusedEntry> FUSED_ORDER =
      Comparator.comparingDouble(FusedEntry::score)
          .reversed()
          .thenComparing(Comparator.comparingInt(FusedEntry::listCount).reversed())
          .thenComparingInt(FusedEntry::denseRank)
          .thenComparing(FusedEntry::documentId);

  private ReciprocalRankFusion() {}

  /**
   * Fuses ranked lists into a single ordering.
   *
   * @param rankedLists the lists to fuse; any of them may be empty
   * @param k the damping constant, must be positive
   * @return every document that appeared in any list, best first; empty if all lists are empty
   */
  public static List<FusedResult> fuse(List<List<RankedHit>> rankedLists, int k) {
    if (k < 1) {
      throw new IllegalArgumentException("k must be positive, got: " + k);
    }

    Map<String, Accumulator> byDocument = new HashMap<>();
    for (List<RankedHit> list : rankedLists) {
      for (RankedHit hit : bestRankPerDocument(list).values()) {
        byDocument.computeIfAbsent(hit.documentId(), Accumulator::new).add(hit, k);
      }
    }

    return byDocument.values().stream()
        .map(Accumulator::toEntry)
        .sorted(FUSED_ORDER)
        .map(FusedEntry::toResult)
        .toList();
  }

  /** Fuses with {@link #DEFAULT_K}. */
  public static List<FusedResult> fuse(List<List<RankedHit>> rankedLists) {
    return fuse(rankedLists, DEFAULT_K);
  }

  private static Map<String, RankedHit> bestRankPerDocument(List<RankedHit> list) {
    Map<String, RankedHit> best = new LinkedHashMap<>();
    for (RankedHit hit : list) {
      best.merge(hit.documentId(), hit, (a, b) -> a.rank() <= b.rank() ? a : b);
    }
    return best;
  }

  /** Per-document running state while lists are consumed. */
  private static final class Accumulator {

    private final String documentId;
    private final List<Double> contributions = new ArrayList<>();
    private final Set<RetrievalSource> sources = EnumSet.noneOf(RetrievalSource.class);
    private int denseRank = Integer.MAX_VALUE;

    private Accumulator(String documentId) {
      this.documentId = documentId;
    }

    private void add(RankedHit hit, int k) {
      contributions.add(1.0 / (k + hit.rank()));
      sources.add(hit.source());
      if (hit.source() == RetrievalSource.DENSE) {
        denseRank = Math.min(denseRank, hit.rank());
      }
    }

    private FusedEntry toEntry() {
      List<Double> ordered = new ArrayList<>(contributions);
      Collections.sort(ordered);
      double score = 0.0;
      for (double contribution : ordered) {
        score += contribution;
      }
      return new FusedEntry(documentId, score, contributions.size(), denseRank, sources);
    }
  }

  private record FusedEntry(
      String documentId,
      double score,
      int listCount,
      int denseRank,
      Set<RetrievalSource> sources) {

    FusedResult toResult() {
      return new FusedResult(documentId, score, sources);
    }
  }
}
