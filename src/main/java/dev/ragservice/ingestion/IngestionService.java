package dev.ragservice.ingestion;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.ragservice.document.DocumentIndex;
import dev.ragservice.document.TenantDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Adds documents to a tenant's index and removes tenants.
 *
 * <p>Pipeline: document -> embed with the in-process model -> upsert into the
 * {@link DocumentIndex}, where it becomes searchable by both the dense and the sparse branch.
 * A document is stored whole; re-ingesting the same tenant and document id replaces the earlier
 * version.
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final DocumentIndex documentIndex;
    private final EmbeddingModel embeddingModel;

    public IngestionService(DocumentIndex documentIndex, EmbeddingModel embeddingModel) {
        this.documentIndex = documentIndex;
        this.embeddingModel = embeddingModel;
    }

    /**
     * Embeds and stores one document.
     *
     * @param document the document to index
     * @return time spent embedding and storing, in milliseconds
     */
    public double ingest(TenantDocument document) {
        long start = System.nanoTime();
        Embedding embedding = embeddingModel.embed(document.content()).content();
        documentIndex.upsert(document, embedding);
        double elapsedMs = (System.nanoTime() - start) / 1_000_000.0;
        log.info("Ingested document {} for tenant {} ({} chars) in {}ms",
                document.documentId(), document.tenantId(), document.content().length(),
                Math.round(elapsedMs));
        return elapsedMs;
    }

    /**
     * Removes every document of a tenant.
     *
     * @param tenantId the tenant to clear
     * @return number of documents removed
     */
    public int deleteTenant(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be blank");
        }
        int deleted = documentIndex.deleteTenant(tenantId);
        log.info("Deleted {} documents for tenant {}", deleted, tenantId);
        return deleted;
    }
}
