package dev.ragservice.search;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.ragservice.document.DocumentIndex;
import dev.ragservice.document.IndexMatch;
import dev.ragservice.resilience.BoundedCall;
import dev.ragservice.resilience.BoundedResults;
import dev.ragservice.resilience.BreakerCall;
import dev.ragservice.resilience.CircuitBreaker;
import dev.ragservice.resilience.CircuitBreakerRegistry;
import dev.ragservice.resilience.DeadlineGuard;
import dev.ragservice.resilience.Outcome;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Tenant-scoped hybrid search: dense and sparse retrieval in parallel, fused with Reciprocal Rank
 * Fusion.
 *
 * <p>Pipeline: issue both retrieval calls concurrently through the vector-store circuit breaker,
 * each under a per-branch sub-deadline inside the overall search budget; a branch abandoned at its
 * deadline counts as a breaker failure even if its I/O never returns -> replace a failed, timed
 * out or breaker-rejected branch with an empty list -> fail with {@link RetrievalFailureException}
 * if neither branch produced a result -> fuse both lists -> truncate to {@code topK} -> attach
 * content and metadata.
 *
 * <p>Both branch calls are built from the same request, so they always carry the same tenant id.
 * Truncation happens only after fusion; each branch fetches {@code topK * candidateMultiplier}
 * candidates.
 */
@Service
public class SearchOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(SearchOrchestrator.class);

  private static final int LOGGED_QUERY_CHARS = 60;

  private final DocumentIndex documentIndex;
  private final EmbeddingModel embeddingModel;
  private final CircuitBreakerRegistry breakers;
  private final DeadlineGuard deadlineGuard;
  private final SearchProperties properties;

  public SearchOrchestrator(
      DocumentIndex documentIndex,
      EmbeddingModel embeddingModel,
      CircuitBreakerRegistry breakers,
      DeadlineGuard deadlineGuard,
      SearchProperties properties) {
    this.documentIndex = documentIndex;
    this.embeddingModel = embeddingModel;
    this.breakers = breakers;
    this.deadlineGuard = deadlineGuard;
    this.properties = properties;
  }

  /**
   * Runs a hybrid search for one tenant.
   *
   * @param request the tenant, query and result count
   * @return up to {@code topK} fused hits; an empty list when neither branch matched anything
   * @throws RetrievalFailureException if both retrieval branches failed or timed out
   */
  public SearchResponse search(SearchRequest request) {
    long start = System.nanoTime();
    int candidates = request.topK() * properties.getCandidateMultiplier();
    CircuitBreaker breaker = breakers.vectorStore();
    BreakerCall denseCall = new BreakerCall(breaker);
    BreakerCall sparseCall = new BreakerCall(breaker);

    List<BoundedCall<List<IndexMatch>>> calls =
        List.of(
            BoundedCall.guarded(
                RetrievalSource.DENSE.label(),
                () -> denseRetrieval(denseCall, request, candidates),
                properties.getBranchBudget(),
                denseCall),
            BoundedCall.guarded(
                RetrievalSource.SPARSE.label(),
                () ->
                    sparseCall.execute(
                        () ->
                            documentIndex.querySparse(
                                request.tenantId(), request.query(), candidates)),
                properties.getBranchBudget(),
                sparseCall));

    BoundedResults<List<IndexMatch>> results =
        deadlineGuard.runBounded(calls, properties.getBudget());
    Outcome<List<IndexMatch>> dense = results.outcome(RetrievalSource.DENSE.label());
    Outcome<List<IndexMatch>> sparse = results.outcome(RetrievalSource.SPARSE.label());

    if (!results.hasUsableResult()) {
      log.warn(
          "Search failed for tenant {}: {}; {}",
          request.tenantId(),
          dense.describe(),
          sparse.describe());
      throw new RetrievalFailureException(
          request.tenantId(), List.of(dense.describe(), sparse.describe()));
    }

    Set<RetrievalSource> degraded = EnumSet.noneOf(RetrievalSource.class);
    List<IndexMatch> denseMatches = branchMatches(dense, RetrievalSource.DENSE, degraded);
    List<IndexMatch> sparseMatches = branchMatches(sparse, RetrievalSource.SPARSE, degraded);

    List<FusedResult> fused =
        ReciprocalRankFusion.fuse(
            List.of(
                toRankedHits(denseMatches, RetrievalSource.DENSE),
                toRankedHits(sparseMatches, RetrievalSource.SPARSE)),
            properties.getRrfK());

    Map<String, IndexMatch> byDocument = new LinkedHashMap<>();
    denseMatches.forEach(m -> byDocument.putIfAbsent(m.documentId(), m));
    sparseMatches.forEach(m -> byDocument.putIfAbsent(m.documentId(), m));

    List<SearchHit> hits =
        fused.stream()
            .limit(request.topK())
            .map(f -> toHit(f, byDocument.get(f.documentId())))
            .toList();

    double latencyMs = (System.nanoTime() - start) / 1_000_000.0;
    log.info(
        "Search tenant={} query=\"{}\" dense={} sparse={} fused={} returned={} degraded={} in {}ms",
        request.tenantId(),
        abbreviate(request.query()),
        denseMatches.size(),
        sparseMatches.size(),
        fused.size(),
        hits.size(),
        degraded,
        Math.round(latencyMs));
    return new SearchResponse(hits, latencyMs, degraded);
  }

  private List<IndexMatch> denseRetrieval(
      BreakerCall storeCall, SearchRequest request, int candidates) {
    Embedding queryEmbedding = embeddingModel.embed(request.query()).content();
    return storeCall.execute(
        () -> documentIndex.queryDense(request.tenantId(), queryEmbedding, candidates));
  }

  private static List<IndexMatch> branchMatches(
      Outcome<List<IndexMatch>> outcome, RetrievalSource source, Set<RetrievalSource> degraded) {
    if (outcome.isCompleted()) {
      return outcome.valueOr(List.of());
    }
    degraded.add(source);
    if (outcome.isCircuitOpen()) {
      log.warn("Skipped {} retrieval: vector-store circuit open", source.label());
    } else {
      log.warn("Degraded search without {} branch ({})", source.label(), outcome.describe());
    }
    return List.of();
  }

  static List<RankedHit> toRankedHits(List<IndexMatch> matches, RetrievalSource source) {
    List<RankedHit> ranked = new ArrayList<>(matches.size());
    for (int i = 0; i < matches.size(); i++) {
      IndexMatch match = matches.get(i);
      ranked.add(new RankedHit(match.documentId(), i + 1, source, match.score()));
    }
    return ranked;
  }

  private static SearchHit toHit(FusedResult fused, IndexMatch match) {
    return new SearchHit(
        fused.documentId(), match.content(), fused.fusedScore(), match.metadata(), fused.sources());
  }

  static String abbreviate(String query) {
    String collapsed = query.strip().replaceAll("\\s+", " ");
    return collapsed.length() <= LOGGED_QUERY_CHARS
        ? collapsed
        : collapsed.substring(0, LOGGED_QUERY_CHARS) + "...";
  }
}
