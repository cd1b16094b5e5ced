package dev.ragservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the multi-tenant hybrid search service.
 *
 * <p>Runs against PostgreSQL with pgvector by default; the {@code local} profile switches to an
 * in-process index with no database.
 */
@SpringBootApplication
public class RagServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(RagServiceApplication.class, args);
    }
}
