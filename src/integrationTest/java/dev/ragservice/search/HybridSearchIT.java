package dev.ragservice.search;

import static org.assertj.core.api.Assertions.assertThat;

import dev.ragservice.IntegrationTestBase;
import dev.ragservice.document.TenantDocument;
import dev.ragservice.ingestion.IngestionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class HybridSearchIT extends IntegrationTestBase {

  @Autowired IngestionService ingestionService;

  @Autowired SearchOrchestrator searchOrchestrator;

  static final String ROUTING_TEXT =
      "To configure routing in Spring Boot, use @RequestMapping annotation "
          + "on controller methods. Routes map HTTP methods and URL patterns to handler methods.";

  static final String ANGULAR_TEXT =
      "The RouterModule in Angular provides directives and services for "
          + "in-app navigation. Import RouterModule.forRoot(routes) in your AppModule.";

  static final String JSONB_TEXT =
      "PostgreSQL supports JSONB columns for storing semi-structured data. "
          + "Use the -> operator to access JSON fields.";

  @BeforeEach
  void seedTestData() {
    ingestionService.ingest(new TenantDocument("docs", "spring-routing", ROUTING_TEXT));
    ingestionService.ingest(new TenantDocument("docs", "angular-routing", ANGULAR_TEXT));
    ingestionService.ingest(new TenantDocument("docs", "postgres-jsonb", JSONB_TEXT));
    ingestionService.ingest(new TenantDocument("other", "other-routing", ROUTING_TEXT));
  }

  @Test
  void documentFoundByBothBranchesRanksFirst() {
    SearchResponse response =
        searchOrchestrator.search(new SearchRequest("docs", "PostgreSQL JSONB columns", 3));

    assertThat(response.isPartial()).isFalse();
    assertThat(response.hits().get(0).documentId()).isEqualTo("postgres-jsonb");
    assertThat(response.hits().get(0).sources())
        .containsExactlyInAnyOrder(RetrievalSource.DENSE, RetrievalSource.SPARSE);
  }

  @Test
  void semanticOnlyMatchesStillSurface() {
    SearchResponse response =
        searchOrchestrator.search(new SearchRequest("docs", "how to set up URL navigation", 3));

    assertThat(response.hits())
        .extracting(SearchHit::documentId)
        .containsAnyOf("spring-routing", "angular-routing");
  }

  @Test
  void resultsAreTruncatedToTopKAndStayInTenant() {
    SearchResponse response =
        searchOrchestrator.search(new SearchRequest("docs", "routing", 2));

    assertThat(response.hits()).hasSize(2);
    assertThat(response.hits())
        .extracting(SearchHit::documentId)
        .doesNotContain("other-routing");
  }
}
