package dev.ragservice.summary;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import dev.ragservice.IntegrationTestBase;
import dev.ragservice.document.TenantDocument;
import dev.ragservice.ingestion.IngestionService;
import dev.ragservice.search.SearchRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/** Search-with-summary over a real index, with the language model replaced by a scripted stream. */
class SearchWithSummaryIT extends IntegrationTestBase {

  @Autowired IngestionService ingestionService;

  @Autowired SummaryPipeline summaryPipeline;

  @MockitoBean SummaryGenerator summaryGenerator;

  @BeforeEach
  void seed() {
    ingestionService.ingest(
        new TenantDocument("acme", "refunds", "Refunds are issued within 30 days of purchase."));
  }

  @Test
  void summarisesTheFusedHits() {
    QueueingGenerationStream stream = new QueueingGenerationStream();
    stream.emit("Refunds take up to 30 days.");
    stream.complete();
    when(summaryGenerator.generate(anyString())).thenReturn(stream);

    SummaryResponse response =
        summaryPipeline.searchWithSummary(new SearchRequest("acme", "refund period"));

    assertThat(response.status()).isEqualTo(SummaryStatus.COMPLETE);
    assertThat(response.summary()).isEqualTo("Refunds take up to 30 days.");
    assertThat(response.hits()).extracting(h -> h.documentId()).containsExactly("refunds");
  }

  @Test
  void unknownTenantSkipsGeneration() {
    SummaryResponse response =
        summaryPipeline.searchWithSummary(new SearchRequest("nobody", "refund period"));

    assertThat(response.status()).isEqualTo(SummaryStatus.SKIPPED);
    assertThat(response.hits()).isEmpty();
  }
}
