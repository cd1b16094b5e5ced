package dev.ragservice;

import static org.assertj.core.api.Assertions.assertThat;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.ragservice.api.HealthController;
import dev.ragservice.api.HealthResponse;
import dev.ragservice.document.DocumentChunk;
import dev.ragservice.document.DocumentChunkRepository;
import dev.ragservice.document.DocumentIndex;
import dev.ragservice.document.PgVectorDocumentIndex;
import dev.ragservice.document.TenantDocument;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

/**
 * Boots the full application against the Flyway schema: migrations applied, ONNX model loaded,
 * JPA mapping validated, pgvector store wired.
 */
class ApplicationSmokeIT extends IntegrationTestBase {

    @Autowired
    private DocumentIndex documentIndex;

    @Autowired
    private DocumentChunkRepository documentChunkRepository;

    @Autowired
    private EmbeddingModel embeddingModel;

    @Autowired
    private HealthController healthController;

    @Test
    void pgvectorIndexIsTheDefault() {
        assertThat(documentIndex).isInstanceOf(PgVectorDocumentIndex.class);
        assertThat(embeddingModel.dimension()).isEqualTo(384);
    }

    @Test
    void healthIsGreenOnFreshStart() {
        HealthResponse health = healthController.health();

        assertThat(health.status()).isEqualTo("healthy");
        assertThat(health.indexReachable()).isTrue();
        assertThat(health.breakers()).containsOnlyKeys("vector-store", "generation");
    }

    @Test
    void documentRowWrittenByLangchain4jIsReadableViaJpa() {
        TenantDocument document = new TenantDocument("acme", "schema-check", "JPA schema drift test");
        Embedding embedding = embeddingModel.embed(document.content()).content();
        documentIndex.upsert(document, embedding);

        List<DocumentChunk> rows = documentChunkRepository.findAll();

        assertThat(rows).hasSize(1);
        DocumentChunk row = rows.get(0);
        assertThat(row.getText()).isEqualTo("JPA schema drift test");
        assertThat(row.getMetadata()).contains("\"tenant_id\"").contains("\"schema-check\"");
        assertThat(row.getCreatedAt()).isNotNull();
    }
}
