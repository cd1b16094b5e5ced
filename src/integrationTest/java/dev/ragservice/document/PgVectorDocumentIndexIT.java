package dev.ragservice.document;

import static org.assertj.core.api.Assertions.assertThat;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.ragservice.IntegrationTestBase;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

class PgVectorDocumentIndexIT extends IntegrationTestBase {

  @Autowired DocumentIndex documentIndex;

  @Autowired DocumentChunkRepository documentChunkRepository;

  @Autowired EmbeddingModel embeddingModel;

  @Autowired RetrievalPool retrievalPool;

  @BeforeEach
  void seed() {
    add("acme", "refunds", "Refunds are issued within 30 days of purchase.", Map.of("lang", "en"));
    add("acme", "shipping", "Orders ship within two business days.", Map.of());
    add("globex", "refunds", "Globex never issues refunds on digital goods.", Map.of());
  }

  private void add(String tenant, String id, String content, Map<String, Object> metadata) {
    TenantDocument document = new TenantDocument(tenant, id, content, metadata);
    documentIndex.upsert(document, embeddingModel.embed(content).content());
  }

  private static List<String> ids(List<IndexMatch> matches) {
    return matches.stream().map(IndexMatch::documentId).toList();
  }

  @Test
  void sparseSearchUsesFullTextRankWithinTenant() {
    List<IndexMatch> matches = documentIndex.querySparse("acme", "refunds issued", 10);

    assertThat(ids(matches)).containsExactly("refunds");
    assertThat(matches.get(0).content()).startsWith("Refunds are issued");
    assertThat(matches.get(0).metadata()).containsOnly(Map.entry("lang", "en"));
    assertThat(matches.get(0).score()).isPositive();
  }

  @Test
  void sparseSearchStemsEnglishWords() {
    assertThat(ids(documentIndex.querySparse("acme", "shipped order", 10)))
        .containsExactly("shipping");
  }

  @Test
  void denseSearchNeverReturnsAnotherTenantsDocuments() {
    List<IndexMatch> matches =
        documentIndex.queryDense(
            "globex", embeddingModel.embed("refund policy for purchases").content(), 10);

    assertThat(matches).hasSize(1);
    assertThat(matches.get(0).content()).startsWith("Globex");
    assertThat(matches.get(0).metadata()).doesNotContainKeys("tenant_id", "document_id");
  }

  @Test
  void sparseSearchNeverReturnsAnotherTenantsDocuments() {
    assertThat(documentIndex.querySparse("globex", "orders ship", 10)).isEmpty();
  }

  @Test
  void upsertReplacesExistingDocument() {
    add("acme", "refunds", "Refunds now take 60 days.", Map.of());

    assertThat(documentChunkRepository.countByTenant("acme")).isEqualTo(2);
    assertThat(documentIndex.querySparse("acme", "60 days", 10))
        .extracting(IndexMatch::content)
        .containsExactly("Refunds now take 60 days.");
  }

  @Test
  void concurrentReingestsOfOneDocumentLeaveExactlyOneRow() throws Exception {
    Embedding embedding = embeddingModel.embed("Refunds take 90 days.").content();
    ExecutorService writers = Executors.newFixedThreadPool(8);
    CountDownLatch go = new CountDownLatch(1);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int i = 0; i < 8; i++) {
        String content = "Refunds take 90 days, revision " + i + ".";
        futures.add(
            writers.submit(
                () -> {
                  go.await();
                  documentIndex.upsert(
                      new TenantDocument("acme", "refunds", content, Map.of()), embedding);
                  return null;
                }));
      }
      go.countDown();
      for (Future<?> future : futures) {
        future.get(30, TimeUnit.SECONDS);
      }
    } finally {
      writers.shutdownNow();
    }

    assertThat(documentChunkRepository.countByTenant("acme")).isEqualTo(2);
    assertThat(documentIndex.querySparse("acme", "revision", 10)).hasSize(1);
  }

  @Test
  void retrievalSessionsCarryTheBranchBudgetAsStatementTimeout() {
    JdbcTemplate retrieval = new JdbcTemplate(retrievalPool.dataSource());

    assertThat(retrieval.queryForObject("SHOW statement_timeout", String.class))
        .isEqualTo(retrievalPool.statementTimeout().toMillis() + "ms");
  }

  @Test
  void retrievalQueryOutlivingTheBranchBudgetIsCancelledByTheServer() {
    JdbcTemplate retrieval = new JdbcTemplate(retrievalPool.dataSource());

    long start = System.nanoTime();
    assertThatThrownBy(() -> retrieval.execute("SELECT pg_sleep(5)"))
        .isInstanceOf(DataAccessException.class);
    long elapsedMs = (System.nanoTime() - start) / 1_000_000;

    assertThat(elapsedMs).isLessThan(3_000);
  }

  @Test
  void deleteTenantRemovesOnlyThatTenant() {
    assertThat(documentIndex.deleteTenant("acme")).isEqualTo(2);

    assertThat(documentChunkRepository.countByTenant("acme")).isZero();
    assertThat(documentChunkRepository.countByTenant("globex")).isEqualTo(1);
  }

  @Test
  void indexReportsReachable() {
    assertThat(documentIndex.isReachable()).isTrue();
  }
}
