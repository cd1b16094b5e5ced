package dev.ragservice.search;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

/**
 * Property-based tests for {@link ReciprocalRankFusion} using jqwik.
 *
 * <p>Lists are generated from a small id alphabet so that overlaps, and therefore ties and
 * multi-list documents, are frequent.
 */
class ReciprocalRankFusionPropertyTest {

  @Provide
  Arbitrary<List<String>> documentIds() {
    return Arbitraries.strings()
        .withChars("abcdefghij")
        .ofLength(2)
        .list()
        .uniqueElements()
        .ofMaxSize(15);
  }

  @Provide
  Arbitrary<Integer> kValues() {
    return Arbitraries.integers().between(1, 200);
  }

  private static List<RankedHit> ranked(List<String> ids, RetrievalSource source) {
    List<RankedHit> hits = new ArrayList<>();
    for (int i = 0; i < ids.size(); i++) {
      hits.add(new RankedHit(ids.get(i), i + 1, source));
    }
    return hits;
  }

  @Property
  void fusionIsDeterministic(
      @ForAll("documentIds") List<String> denseIds,
      @ForAll("documentIds") List<String> sparseIds,
      @ForAll("kValues") int k) {
    List<List<RankedHit>> lists =
        List.of(ranked(denseIds, RetrievalSource.DENSE), ranked(sparseIds, RetrievalSource.SPARSE));

    assertThat(ReciprocalRankFusion.fuse(lists, k)).isEqualTo(ReciprocalRankFusion.fuse(lists, k));
  }

  @Property
  void fusionDoesNotDependOnListOrder(
      @ForAll("documentIds") List<String> denseIds,
      @ForAll("documentIds") List<String> sparseIds,
      @ForAll("kValues") int k) {
    List<RankedHit> dense = ranked(denseIds, RetrievalSource.DENSE);
    List<RankedHit> sparse = ranked(sparseIds, RetrievalSource.SPARSE);

    assertThat(ReciprocalRankFusion.fuse(List.of(sparse, dense), k))
        .isEqualTo(ReciprocalRankFusion.fuse(List.of(dense, sparse), k));
  }

  @Property
  void singleSourcePreservesOrder(
      @ForAll("documentIds") List<String> ids, @ForAll("kValues") int k) {
    List<FusedResult> fused =
        ReciprocalRankFusion.fuse(List.of(ranked(ids, RetrievalSource.SPARSE), List.of()), k);

    assertThat(fused).extracting(FusedResult::documentId).containsExactlyElementsOf(ids);
  }

  @Property
  void everyInputDocumentAppearsExactlyOnce(
      @ForAll("documentIds") List<String> denseIds,
      @ForAll("documentIds") List<String> sparseIds) {
    List<FusedResult> fused =
        ReciprocalRankFusion.fuse(
            List.of(
                ranked(denseIds, RetrievalSource.DENSE), ranked(sparseIds, RetrievalSource.SPARSE)));

    Set<String> expected =
        Stream.concat(denseIds.stream(), sparseIds.stream())
            .collect(Collectors.toSet());
    assertThat(fused).extracting(FusedResult::documentId).doesNotHaveDuplicates();
    assertThat(fused).extracting(FusedResult::documentId).containsExactlyInAnyOrderElementsOf(expected);
  }

  @Property
  void scoresAreNonIncreasing(
      @ForAll("documentIds") List<String> denseIds,
      @ForAll("documentIds") List<String> sparseIds,
      @ForAll("kValues") int k) {
    List<FusedResult> fused =
        ReciprocalRankFusion.fuse(
            List.of(
                ranked(denseIds, RetrievalSource.DENSE), ranked(sparseIds, RetrievalSource.SPARSE)),
            k);

    for (int i = 1; i < fused.size(); i++) {
      assertThat(fused.get(i).fusedScore()).isLessThanOrEqualTo(fused.get(i - 1).fusedScore());
    }
  }
}
