package dev.ragservice.document;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Process-local {@link DocumentIndex} for development and tests.
 *
 * <p>Dense retrieval uses LangChain4j's {@link InMemoryEmbeddingStore} filtered on {@code
 * tenant_id}. Sparse retrieval scores the tenant's documents with term frequency weighted by a
 * smoothed inverse document frequency computed over that tenant only.
 *
 * <p>Writes are serialised; reads run concurrently against the concurrent maps and the store.
 */
@Component
@ConditionalOnProperty(name = "ragservice.index.type", havingValue = "in-memory")
public class InMemoryDocumentIndex implements DocumentIndex {

  private static final Logger log = LoggerFactory.getLogger(InMemoryDocumentIndex.class);

  private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

  private final InMemoryEmbeddingStore<TextSegment> store = new InMemoryEmbeddingStore<>();
  private final ConcurrentMap<String, ConcurrentMap<String, StoredDocument>> tenants =
      new ConcurrentHashMap<>();
  private final Object writeLock = new Object();

  @Override
  public List<IndexMatch> queryDense(String tenantId, Embedding queryEmbedding, int limit) {
    return TenantSegments.denseSearch(store, tenantId, queryEmbedding, limit);
  }

  @Override
  public List<IndexMatch> querySparse(String tenantId, String queryText, int limit) {
    Map<String, StoredDocument> documents = tenants.getOrDefault(tenantId, new ConcurrentHashMap<>());
    Set<String> queryTerms = new LinkedHashSet<>(tokenize(queryText));
    if (documents.isEmpty() || queryTerms.isEmpty()) {
      return List.of();
    }

    Map<String, Double> idf = new HashMap<>();
    int documentCount = documents.size();
    for (String term : queryTerms) {
      long frequency =
          documents.values().stream().filter(d -> d.termCounts().containsKey(term)).count();
      idf.put(term, Math.log(1.0 + (documentCount - frequency + 0.5) / (frequency + 0.5)));
    }

    List<IndexMatch> matches = new ArrayList<>();
    for (StoredDocument document : documents.values()) {
      double score = 0.0;
      for (String term : queryTerms) {
        Integer count = document.termCounts().get(term);
        if (count != null) {
          score += count * idf.get(term);
        }
      }
      if (score > 0.0) {
        matches.add(
            new IndexMatch(document.documentId(), score, document.content(), document.metadata()));
      }
    }
    matches.sort(
        Comparator.comparingDouble(IndexMatch::score)
            .reversed()
            .thenComparing(IndexMatch::documentId));
    return matches.size() > limit ? List.copyOf(matches.subList(0, limit)) : matches;
  }

  @Override
  public void upsert(TenantDocument document, Embedding embedding) {
    synchronized (writeLock) {
      store.removeAll(TenantSegments.documentFilter(document.tenantId(), document.documentId()));
      store.add(embedding, TenantSegments.toSegment(document));
      tenants
          .computeIfAbsent(document.tenantId(), id -> new ConcurrentHashMap<>())
          .put(
              document.documentId(),
              new StoredDocument(
                  document.documentId(),
                  document.content(),
                  document.metadata(),
                  termCounts(document.content())));
    }
    log.debug("Indexed document {} for tenant {}", document.documentId(), document.tenantId());
  }

  @Override
  public int deleteTenant(String tenantId) {
    synchronized (writeLock) {
      Map<String, StoredDocument> removed = tenants.remove(tenantId);
      store.removeAll(TenantSegments.tenantFilter(tenantId));
      return removed == null ? 0 : removed.size();
    }
  }

  @Override
  public boolean isReachable() {
    return true;
  }

  static List<String> tokenize(String text) {
    List<String> tokens = new ArrayList<>();
    for (String token : NON_WORD.split(text.toLowerCase(Locale.ROOT))) {
      if (!token.isEmpty()) {
        tokens.add(token);
      }
    }
    return tokens;
  }

  private static Map<String, Integer> termCounts(String content) {
    Map<String, Integer> counts = new HashMap<>();
    for (String token : tokenize(content)) {
      counts.merge(token, 1, Integer::sum);
    }
    return Map.copyOf(counts);
  }

  private record StoredDocument(
      String documentId,
      String content,
      Map<String, Object> metadata,
      Map<String, Integer> termCounts) {}
}
