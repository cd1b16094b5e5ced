package dev.ragservice.config;

import com.zaxxer.hikari.HikariDataSource;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.ragservice.document.RetrievalPool;
import dev.ragservice.search.SearchProperties;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.JdbcConnectionDetails;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures the retrieval pool and the embedding store that queries through it.
 *
 * <p>The pool connects to the same database as the primary data source but every session carries
 * a {@code statement_timeout} equal to {@code ragservice.search.branch-budget}. A branch abandoned by
 * the search deadline therefore releases its connection and its worker once PostgreSQL cancels the
 * statement, instead of holding both until the query finishes.
 *
 * <p>The pool is not registered as a {@code DataSource} bean; JPA and Flyway keep using the
 * auto-configured primary data source.
 */
@Configuration
@ConditionalOnProperty(name = "ragservice.index.type", havingValue = "pgvector", matchIfMissing = true)
public class RetrievalPoolConfig {

    private static final Logger log = LoggerFactory.getLogger(RetrievalPoolConfig.class);

    /** HikariCP rejects connection timeouts below 250ms. */
    private static final long MIN_CONNECTION_TIMEOUT_MS = 250;

    /**
     * Builds the retrieval pool from the primary connection details.
     *
     * @param connectionDetails URL and credentials of the primary data source
     * @param searchProperties  source of the branch budget used as statement timeout
     * @param poolSize          maximum connections in the retrieval pool
     * @return the retrieval pool, closed on shutdown
     */
    @Bean(destroyMethod = "close")
    public RetrievalPool retrievalPool(
            JdbcConnectionDetails connectionDetails,
            SearchProperties searchProperties,
            @Value("${ragservice.index.retrieval-pool-size:16}") int poolSize) {
        Duration statementTimeout = searchProperties.getBranchBudget();

        HikariDataSource dataSource = new HikariDataSource();
        dataSource.setPoolName("retrieval");
        dataSource.setJdbcUrl(connectionDetails.getJdbcUrl());
        dataSource.setUsername(connectionDetails.getUsername());
        dataSource.setPassword(connectionDetails.getPassword());
        if (connectionDetails.getDriverClassName() != null) {
            dataSource.setDriverClassName(connectionDetails.getDriverClassName());
        }
        dataSource.setMaximumPoolSize(poolSize);
        dataSource.setConnectionTimeout(
                Math.max(MIN_CONNECTION_TIMEOUT_MS, statementTimeout.toMillis()));
        dataSource.setConnectionInitSql(statementTimeoutSql(statementTimeout));
        dataSource.addDataSourceProperty("socketTimeout", socketTimeoutSeconds(statementTimeout));

        log.info("Retrieval pool: max {} connections, statement timeout {}ms",
                poolSize, statementTimeout.toMillis());
        return new RetrievalPool(dataSource, statementTimeout);
    }

    /**
     * Embedding store used for dense queries; shares the table with the primary store.
     *
     * @param retrievalPool the bounded read pool
     * @param table         the table written by the primary store
     * @return a pgvector store whose queries are cancelled server-side at the branch budget
     */
    @Bean
    public EmbeddingStore<TextSegment> retrievalEmbeddingStore(
            RetrievalPool retrievalPool,
            @Value("${ragservice.index.table:document_chunks}") String table) {
        return EmbeddingConfig.pgVectorStore(retrievalPool.dataSource(), table);
    }

    static String statementTimeoutSql(Duration timeout) {
        return "SET statement_timeout = " + Math.max(1, timeout.toMillis());
    }

    /** Whole seconds, rounded up, plus one second of slack over the statement timeout. */
    static int socketTimeoutSeconds(Duration timeout) {
        return (int) ((timeout.toMillis() + 999) / 1000) + 1;
    }
}
