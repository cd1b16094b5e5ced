package dev.ragservice.document;

import com.zaxxer.hikari.HikariDataSource;
import java.time.Duration;
import javax.sql.DataSource;

/**
 * Connection pool reserved for the retrieval read path.
 *
 * <p>Every session in this pool starts with {@code SET statement_timeout}, so PostgreSQL cancels a
 * dense or sparse query that outlives the branch budget even after the calling thread has been
 * abandoned. The driver's socket timeout bounds a connection whose server stopped answering.
 * Writes go through the application's primary pool.
 */
public final class RetrievalPool implements AutoCloseable {

  private final HikariDataSource dataSource;
  private final Duration statementTimeout;

  public RetrievalPool(HikariDataSource dataSource, Duration statementTimeout) {
    this.dataSource = dataSource;
    this.statementTimeout = statementTimeout;
  }

  public DataSource dataSource() {
    return dataSource;
  }

  public Duration statementTimeout() {
    return statementTimeout;
  }

  @Override
  public void close() {
    dataSource.close();
  }
}
