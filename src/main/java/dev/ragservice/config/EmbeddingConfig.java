package dev.ragservice.config;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2q.AllMiniLmL6V2QuantizedEmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.pgvector.DefaultMetadataStorageConfig;
import dev.langchain4j.store.embedding.pgvector.MetadataStorageConfig;
import dev.langchain4j.store.embedding.pgvector.MetadataStorageMode;
import dev.langchain4j.store.embedding.pgvector.PgVectorEmbeddingStore;
import java.util.List;
import javax.sql.DataSource;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.datasource.TransactionAwareDataSourceProxy;

/**
 * Configures the embedding model and, for the pgvector index, the vector store used for writes.
 *
 * <p>The all-MiniLM-L6-v2 quantized model (384 dimensions) runs in-process on ONNX Runtime; no
 * external embedding API is called. The {@link PgVectorEmbeddingStore} shares the application's
 * HikariCP {@link DataSource} and stores metadata as a single JSONB column so that {@code
 * tenant_id} filters and the full-text query read the same column. Dense queries use a second
 * store on the retrieval pool (see {@link RetrievalPoolConfig}).
 */
@Configuration
public class EmbeddingConfig {

    /** Dimension of all-MiniLM-L6-v2 embeddings; must match the vector column in V1. */
    static final int EMBEDDING_DIMENSION = 384;

    /** Metadata column as created by the V1 migration. */
    static final String METADATA_COLUMN = "metadata JSONB NULL";

    @Bean
    public EmbeddingModel embeddingModel() {
        return new AllMiniLmL6V2QuantizedEmbeddingModel();
    }

    /**
     * Configures the pgvector embedding store used to write documents.
     *
     * <p>The data source is wrapped in a {@link TransactionAwareDataSourceProxy} so the store's
     * statements join a surrounding Spring transaction (see {@code PgVectorDocumentIndex#upsert}).
     *
     * @param dataSource the shared HikariCP data source (no duplicate pool)
     * @param table      the table written by the store
     * @return an embedding store backed by pgvector
     */
    @Bean
    @Primary
    @ConditionalOnProperty(name = "ragservice.index.type", havingValue = "pgvector", matchIfMissing = true)
    public EmbeddingStore<TextSegment> embeddingStore(
            DataSource dataSource,
            @Value("${ragservice.index.table:document_chunks}") String table) {
        return pgVectorStore(new TransactionAwareDataSourceProxy(dataSource), table);
    }

    /** Schema and HNSW index are managed by Flyway; table and index creation are disabled. */
    static EmbeddingStore<TextSegment> pgVectorStore(DataSource dataSource, String table) {
        return PgVectorEmbeddingStore.datasourceBuilder()
                .datasource(dataSource)
                .table(table)
                .dimension(EMBEDDING_DIMENSION)
                .createTable(false)  // Schema managed by Flyway migrations
                .useIndex(false)    // HNSW index managed by Flyway V1
                .metadataStorageConfig(jsonbMetadata())
                .build();
    }

    static MetadataStorageConfig jsonbMetadata() {
        return DefaultMetadataStorageConfig.builder()
                .storageMode(MetadataStorageMode.COMBINED_JSONB)
                .columnDefinitions(List.of(METADATA_COLUMN))
                .build();
    }
}
