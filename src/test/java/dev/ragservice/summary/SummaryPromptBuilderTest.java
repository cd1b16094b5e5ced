package dev.ragservice.summary;

import static org.assertj.core.api.Assertions.assertThat;

import dev.ragservice.fixture.SearchHitBuilder;
import dev.ragservice.search.SearchHit;
import java.util.List;
import org.junit.jupiter.api.Test;

class SummaryPromptBuilderTest {

  private static SummaryPromptBuilder builder(int maxDocuments, int tokenBudget) {
    var props = new SummaryProperties();
    props.setMaxContextDocuments(maxDocuments);
    props.setContextTokenBudget(tokenBudget);
    return new SummaryPromptBuilder(props);
  }

  private static SearchHit hit(String id, String content) {
    return new SearchHitBuilder().documentId(id).content(content).build();
  }

  @Test
  void promptQuotesQueryAndEndsWithSummaryCue() {
    String prompt =
        builder(5, 1500).build("refund window", List.of(hit("a", "Refunds within 30 days.")));

    assertThat(prompt)
        .startsWith(
            "Based on the following search results, provide a concise summary answering the"
                + " query: \"refund window\"")
        .contains("Search Results:\n[1] Refunds within 30 days.")
        .endsWith("Summary:");
  }

  @Test
  void hitsAreNumberedInRankOrder() {
    String context =
        builder(5, 1500).context(List.of(hit("a", "First"), hit("b", "Second"), hit("c", "Third")));

    assertThat(context).isEqualTo("[1] First\n\n[2] Second\n\n[3] Third\n\n");
  }

  @Test
  void onlyTheConfiguredNumberOfHitsIsUsed() {
    String context =
        builder(2, 1500).context(List.of(hit("a", "First"), hit("b", "Second"), hit("c", "Third")));

    assertThat(context).contains("[2] Second").doesNotContain("Third");
  }

  @Test
  void hitsBeyondTheTokenBudgetAreLeftOut() {
    // 100 tokens ~ 400 chars; each entry is ~300 chars, so only the first fits
    String longText = "x".repeat(300);

    String context =
        builder(5, 100).context(List.of(hit("a", longText), hit("b", longText), hit("c", "short")));

    assertThat(context).startsWith("[1] ").doesNotContain("[2]");
  }

  @Test
  void oversizedFirstHitIsCutToTheBudget() {
    String context = builder(5, 100).context(List.of(hit("a", "y".repeat(5_000))));

    assertThat(context).startsWith("[1] yyy");
    assertThat(context.strip()).hasSize(400);
  }

  @Test
  void noHitsGiveEmptyContext() {
    assertThat(builder(5, 1500).context(List.of())).isEmpty();
  }

  @Test
  void tokenEstimateRoundsUp() {
    SummaryPromptBuilder builder = builder(5, 1500);

    assertThat(builder.estimateTokens("abcd")).isEqualTo(1);
    assertThat(builder.estimateTokens("abcde")).isEqualTo(2);
    assertThat(builder.estimateTokens("")).isZero();
  }
}
