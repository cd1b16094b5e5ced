package dev.ragservice.summary;

import dev.ragservice.search.SearchHit;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Builds the summary prompt from the top search hits within a token budget.
 *
 * <p>Uses character-based token estimation (chars / 4). At most {@code maxContextDocuments} hits
 * are numbered {@code [1]}, {@code [2]}, ... and accumulated until the budget is reached. If even
 * the first hit exceeds the budget it is cut at the character level, so the prompt always carries
 * some context.
 */
@Component
public class SummaryPromptBuilder {

  private static final double CHARS_PER_TOKEN = 4.0;

  private final SummaryProperties properties;

  public SummaryPromptBuilder(SummaryProperties properties) {
    this.properties = properties;
  }

  /**
   * Formats the prompt for one query.
   *
   * @param query the user's query, quoted in the instruction
   * @param hits the fused hits, best first
   * @return the complete user prompt
   */
  public String build(String query, List<SearchHit> hits) {
    return """
        Based on the following search results, provide a concise summary answering the query: "%s"

        Search Results:
        %s
        Summary:"""
        .formatted(query, context(hits));
  }

  String context(List<SearchHit> hits) {
    int tokenBudget = properties.getContextTokenBudget();
    int limit = Math.min(hits.size(), properties.getMaxContextDocuments());
    StringBuilder output = new StringBuilder();
    int estimatedTokens = 0;

    for (int i = 0; i < limit; i++) {
      String formatted = "[%d] %s\n\n".formatted(i + 1, hits.get(i).content().strip());
      int entryTokens = estimateTokens(formatted);

      if (i == 0 && entryTokens > tokenBudget) {
        int maxChars = (int) (tokenBudget * CHARS_PER_TOKEN);
        output.append(formatted, 0, Math.min(maxChars, formatted.length())).append("\n\n");
        break;
      }
      if (estimatedTokens + entryTokens > tokenBudget) {
        break;
      }
      output.append(formatted);
      estimatedTokens += entryTokens;
    }
    return output.toString();
  }

  int estimateTokens(String text) {
    return (int) Math.ceil(text.length() / CHARS_PER_TOKEN);
  }
}
