package dev.ragservice;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingStore;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * Shared base class for integration tests.
 *
 * <p>Provides a Testcontainers-managed PostgreSQL instance with pgvector, shared by every subclass,
 * and empties the document table before each test.
 */
@SpringBootTest
public abstract class IntegrationTestBase {

  @ServiceConnection
  static PostgreSQLContainer<?> postgres =
      new PostgreSQLContainer<>(
          DockerImageName.parse("pgvector/pgvector:pg16").asCompatibleSubstituteFor("postgres"));

  static {
    postgres.start();
  }

  @Autowired protected EmbeddingStore<TextSegment> embeddingStore;

  @BeforeEach
  void cleanStore() {
    embeddingStore.removeAll();
  }
}
