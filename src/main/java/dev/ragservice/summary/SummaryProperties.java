package dev.ragservice.summary;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for search-with-summary.
 *
 * <p>Properties are bound from {@code ragservice.summary.*}:
 *
 * <ul>
 *   <li>{@code budget} - generation budget, separate from the search budget (default 2s)
 *   <li>{@code max-context-documents} - top hits placed in the prompt, independent of the
 *       requested topK (default 5, bounded [1, 10])
 *   <li>{@code context-token-budget} - estimated token ceiling for the prompt context (default
 *       1500, bounded [100, 16000])
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "ragservice.summary")
public class SummaryProperties {

  private Duration budget = Duration.ofSeconds(2);
  private int maxContextDocuments = 5;
  private int contextTokenBudget = 1500;

  @PostConstruct
  void validate() {
    if (budget == null || budget.isNegative() || budget.isZero()) {
      throw new IllegalStateException(
          "ragservice.summary.budget must be positive, got: " + budget);
    }
    if (maxContextDocuments < 1 || maxContextDocuments > 10) {
      throw new IllegalStateException(
          "ragservice.summary.max-context-documents must be in [1, 10], got: "
              + maxContextDocuments);
    }
    if (contextTokenBudget < 100 || contextTokenBudget > 16000) {
      throw new IllegalStateException(
          "ragservice.summary.context-token-budget must be in [100, 16000], got: "
              + contextTokenBudget);
    }
  }

  public Duration getBudget() {
    return budget;
  }

  public void setBudget(Duration budget) {
    this.budget = budget;
  }

  public int getMaxContextDocuments() {
    return maxContextDocuments;
  }

  public void setMaxContextDocuments(int maxContextDocuments) {
    this.maxContextDocuments = maxContextDocuments;
  }

  public int getContextTokenBudget() {
    return contextTokenBudget;
  }

  public void setContextTokenBudget(int contextTokenBudget) {
    this.contextTokenBudget = contextTokenBudget;
  }
}
