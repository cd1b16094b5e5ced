package dev.ragservice.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import dev.ragservice.fixture.SearchHitBuilder;
import dev.ragservice.search.RetrievalFailureException;
import dev.ragservice.search.RetrievalSource;
import dev.ragservice.search.SearchHit;
import dev.ragservice.search.SearchOrchestrator;
import dev.ragservice.search.SearchRequest;
import dev.ragservice.search.SearchResponse;
import dev.ragservice.summary.DegradationReason;
import dev.ragservice.summary.SummaryPipeline;
import dev.ragservice.summary.SummaryResponse;
import dev.ragservice.summary.SummarySink;
import dev.ragservice.summary.SummaryStatus;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@WebMvcTest(SearchController.class)
@Import(SearchControllerTest.StreamingExecutorConfig.class)
class SearchControllerTest {

  private static final SearchHit HIT =
      new SearchHitBuilder()
          .documentId("refunds")
          .content("Refunds within 30 days.")
          .metadata("title", "Refund policy")
          .build();

  @Autowired MockMvc mockMvc;

  @MockitoBean SearchOrchestrator searchOrchestrator;

  @MockitoBean SummaryPipeline summaryPipeline;

  @TestConfiguration
  static class StreamingExecutorConfig {
    @Bean(destroyMethod = "shutdownNow")
    ExecutorService streamingExecutor() {
      return Executors.newCachedThreadPool();
    }
  }

  // --- POST /search ---

  @Test
  void searchReturnsFusedResultsInSnakeCase() throws Exception {
    when(searchOrchestrator.search(new SearchRequest("acme", "refund window", 3)))
        .thenReturn(new SearchResponse(List.of(HIT), 42.0, Set.of()));

    mockMvc
        .perform(
            post("/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"tenant_id": "acme", "query": "refund window", "top_k": 3}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.results[0].document_id").value("refunds"))
        .andExpect(jsonPath("$.results[0].content").value("Refunds within 30 days."))
        .andExpect(jsonPath("$.results[0].metadata.title").value("Refund policy"))
        .andExpect(jsonPath("$.results[0].sources[0]").value("dense"))
        .andExpect(jsonPath("$.results[0].sources[1]").value("sparse"))
        .andExpect(jsonPath("$.latency_ms").value(42.0))
        .andExpect(jsonPath("$.degraded_sources").isEmpty());
  }

  @Test
  void searchDefaultsTopKToFive() throws Exception {
    when(searchOrchestrator.search(new SearchRequest("acme", "refund window", 5)))
        .thenReturn(new SearchResponse(List.of(), 3.0, Set.of()));

    mockMvc
        .perform(
            post("/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"tenant_id": "acme", "query": "refund window"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.results").isEmpty());
  }

  @Test
  void partialSearchListsDegradedSources() throws Exception {
    when(searchOrchestrator.search(any()))
        .thenReturn(new SearchResponse(List.of(HIT), 751.0, EnumSet.of(RetrievalSource.SPARSE)));

    mockMvc
        .perform(
            post("/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"tenant_id": "acme", "query": "refund window"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.degraded_sources[0]").value("sparse"));
  }

  @Test
  void blankQueryIsRejected() throws Exception {
    mockMvc
        .perform(
            post("/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"tenant_id": "acme", "query": "  "}
                    """))
        .andExpect(status().isBadRequest());
    verifyNoInteractions(searchOrchestrator);
  }

  @Test
  void missingTenantIsRejected() throws Exception {
    mockMvc
        .perform(
            post("/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"query": "refund window"}
                    """))
        .andExpect(status().isBadRequest());
  }

  @Test
  void topKOutOfRangeIsRejected() throws Exception {
    mockMvc
        .perform(
            post("/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"tenant_id": "acme", "query": "refund window", "top_k": 101}
                    """))
        .andExpect(status().isBadRequest());
  }

  @Test
  void retrievalFailureMapsToServiceUnavailable() throws Exception {
    when(searchOrchestrator.search(any()))
        .thenThrow(
            new RetrievalFailureException(
                "acme", List.of("dense: timed out after 750ms", "sparse: failed (boom)")));

    mockMvc
        .perform(
            post("/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"tenant_id": "acme", "query": "refund window"}
                    """))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.detail").value("Search is temporarily unavailable"))
        .andExpect(jsonPath("$.branches[0]").value("dense: timed out after 750ms"));
  }

  // --- POST /search-with-summary ---

  @Test
  void summaryResponseCarriesStatusAndLatencies() throws Exception {
    when(summaryPipeline.searchWithSummary(new SearchRequest("acme", "refund window", 5)))
        .thenReturn(
            new SummaryResponse(
                List.of(HIT),
                Set.of(),
                "Refunds take 30 days.",
                SummaryStatus.COMPLETE,
                null,
                40,
                900,
                945));

    mockMvc
        .perform(
            post("/search-with-summary")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"tenant_id": "acme", "query": "refund window"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.summary").value("Refunds take 30 days."))
        .andExpect(jsonPath("$.summary_status").value("complete"))
        .andExpect(jsonPath("$.degradation_reason").doesNotExist())
        .andExpect(jsonPath("$.latency_ms").value(945.0))
        .andExpect(jsonPath("$.search_latency_ms").value(40.0))
        .andExpect(jsonPath("$.llm_latency_ms").value(900.0))
        .andExpect(jsonPath("$.degraded_sources").isEmpty())
        .andExpect(jsonPath("$.results[0].document_id").value("refunds"));
  }

  @Test
  void degradedSummaryStillReturnsResultsWithNotice() throws Exception {
    when(summaryPipeline.searchWithSummary(any(SearchRequest.class)))
        .thenReturn(
            new SummaryResponse(
                List.of(HIT),
                Set.of(),
                null,
                SummaryStatus.DEGRADED,
                DegradationReason.CIRCUIT_OPEN,
                40,
                0.1,
                41));

    mockMvc
        .perform(
            post("/search-with-summary")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"tenant_id": "acme", "query": "refund window"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.summary_status").value("degraded"))
        .andExpect(jsonPath("$.degradation_reason").value("circuit_open"))
        .andExpect(jsonPath("$.summary").value(containsString("temporarily unavailable")))
        .andExpect(jsonPath("$.results[0].document_id").value("refunds"));
  }

  @Test
  void summaryOverPartialSearchNamesTheMissingBranch() throws Exception {
    when(summaryPipeline.searchWithSummary(any(SearchRequest.class)))
        .thenReturn(
            new SummaryResponse(
                List.of(HIT),
                EnumSet.of(RetrievalSource.SPARSE),
                "Refunds take 30 days.",
                SummaryStatus.COMPLETE,
                null,
                760,
                900,
                1665));

    mockMvc
        .perform(
            post("/search-with-summary")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"tenant_id": "acme", "query": "refund window"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.summary_status").value("complete"))
        .andExpect(jsonPath("$.degraded_sources.length()").value(1))
        .andExpect(jsonPath("$.degraded_sources[0]").value("sparse"));
  }

  // --- POST /search-with-summary/stream ---

  @Test
  void streamSendsResultsTokensAndFinalSummary() throws Exception {
    SearchResponse search = new SearchResponse(List.of(HIT), 40.0, Set.of());
    when(summaryPipeline.searchWithSummary(
            eq(new SearchRequest("acme", "refund window", 5)), any(SummarySink.class)))
        .thenAnswer(
            invocation -> {
              SummarySink sink = invocation.getArgument(1);
              sink.onSearchComplete(search);
              sink.onFragment("Refunds ");
              sink.onFragment("take 30 days.");
              return new SummaryResponse(
                  List.of(HIT),
                  Set.of(),
                  "Refunds take 30 days.",
                  SummaryStatus.COMPLETE,
                  null,
                  40,
                  80,
                  121);
            });

    MvcResult result =
        mockMvc
            .perform(
                post("/search-with-summary/stream")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"tenant_id": "acme", "query": "refund window"}
                        """))
            .andExpect(request().asyncStarted())
            .andReturn();
    result.getAsyncResult(5_000);

    String body = result.getResponse().getContentAsString();
    assertThat(body)
        .contains("event:results")
        .contains("event:token\ndata:Refunds ")
        .contains("event:token\ndata:take 30 days.")
        .contains("event:summary")
        .contains("\"summary_status\":\"complete\"");
    assertThat(body.indexOf("event:results"))
        .isLessThan(body.indexOf("event:token"));
    assertThat(body.indexOf("event:token"))
        .isLessThan(body.indexOf("event:summary"));
  }

  @Test
  void streamReportsSearchFailureAsErrorEvent() throws Exception {
    when(summaryPipeline.searchWithSummary(any(SearchRequest.class), any(SummarySink.class)))
        .thenThrow(
            new RetrievalFailureException("acme", List.of("dense: failed", "sparse: failed")));

    MvcResult result =
        mockMvc
            .perform(
                post("/search-with-summary/stream")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"tenant_id": "acme", "query": "refund window"}
                        """))
            .andExpect(request().asyncStarted())
            .andReturn();
    result.getAsyncResult(5_000);

    assertThat(result.getResponse().getContentAsString())
        .contains("event:error")
        .contains("Search is temporarily unavailable");
    verify(summaryPipeline).searchWithSummary(any(SearchRequest.class), any(SummarySink.class));
  }

  @Test
  void streamValidatesTheRequestBeforeStarting() throws Exception {
    mockMvc
        .perform(
            post("/search-with-summary/stream")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
        .andExpect(status().isBadRequest())
        .andExpect(content().string(not(containsString("event:"))));
  }
}
