package dev.ragservice.document;

import static org.assertj.core.api.Assertions.assertThat;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.ragservice.fixture.HashingEmbeddingModel;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryDocumentIndexTest {

  private final EmbeddingModel embeddingModel = new HashingEmbeddingModel();
  private InMemoryDocumentIndex index;

  @BeforeEach
  void setUp() {
    index = new InMemoryDocumentIndex();
  }

  private void add(String tenantId, String documentId, String content) {
    add(new TenantDocument(tenantId, documentId, content));
  }

  private void add(TenantDocument document) {
    index.upsert(document, embeddingModel.embed(document.content()).content());
  }

  private static List<String> ids(List<IndexMatch> matches) {
    return matches.stream().map(IndexMatch::documentId).toList();
  }

  // --- Sparse ---

  @Test
  void sparseRanksByTermFrequencyAndSkipsNonMatchingDocuments() {
    add("t1", "orders", "Refund policy for orders placed online");
    add("t1", "shipping", "Shipping policy and delivery times");
    add("t1", "refunds", "Refund timeline: a refund is issued within five days");

    List<IndexMatch> matches = index.querySparse("t1", "refund", 10);

    assertThat(ids(matches)).containsExactly("refunds", "orders");
    assertThat(matches.get(0).score()).isGreaterThan(matches.get(1).score());
  }

  @Test
  void sparseIgnoresCaseAndPunctuation() {
    add("t1", "doc", "PostgreSQL, pgvector & HNSW!");

    assertThat(ids(index.querySparse("t1", "hnsw postgresql?", 10))).containsExactly("doc");
  }

  @Test
  void sparseReturnsNothingWithoutSharedTerms() {
    add("t1", "doc", "Shipping policy");

    assertThat(index.querySparse("t1", "refund", 10)).isEmpty();
    assertThat(index.querySparse("t1", "   ", 10)).isEmpty();
    assertThat(index.querySparse("unknown-tenant", "shipping", 10)).isEmpty();
  }

  @Test
  void sparseHonoursLimit() {
    for (int i = 0; i < 5; i++) {
      add("t1", "doc-" + i, "invoice number " + i);
    }

    assertThat(index.querySparse("t1", "invoice", 3)).hasSize(3);
  }

  // --- Dense ---

  @Test
  void denseRanksClosestDocumentFirst() {
    add("t1", "db", "vector database with approximate nearest neighbour search");
    add("t1", "cooking", "slow roasted tomatoes with garlic and basil");

    List<IndexMatch> matches =
        index.queryDense(
            "t1",
            embeddingModel.embed("vector database with approximate nearest neighbour search").content(),
            2);

    assertThat(matches.get(0).documentId()).isEqualTo("db");
    assertThat(matches.get(0).content()).startsWith("vector database");
  }

  // --- Writes ---

  @Test
  void upsertReplacesEarlierVersion() {
    add("t1", "doc", "first version about invoices");
    add("t1", "doc", "second version about receipts");

    assertThat(index.querySparse("t1", "invoices", 10)).isEmpty();
    assertThat(ids(index.querySparse("t1", "receipts", 10))).containsExactly("doc");
    assertThat(
            index.queryDense("t1", embeddingModel.embed("receipts").content(), 10))
        .hasSize(1)
        .first()
        .satisfies(m -> assertThat(m.content()).isEqualTo("second version about receipts"));
  }

  @Test
  void metadataIsReturnedWithoutReservedKeys() {
    add(new TenantDocument("t1", "doc", "quarterly report", Map.of("year", 2025, "author", "ops")));

    IndexMatch sparse = index.querySparse("t1", "report", 1).get(0);
    IndexMatch dense = index.queryDense("t1", embeddingModel.embed("quarterly report").content(), 1).get(0);

    assertThat(sparse.metadata()).containsOnly(Map.entry("year", 2025), Map.entry("author", "ops"));
    assertThat(dense.metadata()).containsOnlyKeys("year", "author");
    assertThat(dense.metadata()).doesNotContainKeys("tenant_id", "document_id");
  }

  @Test
  void deleteTenantRemovesOnlyThatTenant() {
    add("t1", "a", "shared words here");
    add("t1", "b", "shared words there");
    add("t2", "c", "shared words everywhere");

    assertThat(index.deleteTenant("t1")).isEqualTo(2);

    assertThat(index.querySparse("t1", "shared", 10)).isEmpty();
    assertThat(index.queryDense("t1", embeddingModel.embed("shared words").content(), 10)).isEmpty();
    assertThat(ids(index.querySparse("t2", "shared", 10))).containsExactly("c");
    assertThat(index.deleteTenant("t1")).isZero();
  }

  @Test
  void isAlwaysReachable() {
    assertThat(index.isReachable()).isTrue();
  }

  @Test
  void tokenizeLowercasesAndSplitsOnNonWordCharacters() {
    assertThat(InMemoryDocumentIndex.tokenize("Hello, World! RRF-k=60"))
        .containsExactly("hello", "world", "rrf", "k", "60");
  }
}
