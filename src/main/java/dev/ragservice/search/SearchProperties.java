package dev.ragservice.search;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the search pipeline.
 *
 * <p>Properties are bound from {@code ragservice.search.*} in application.yml.
 *
 * <ul>
 *   <li>{@code rrf-k} - Reciprocal Rank Fusion damping constant (default 60)
 *   <li>{@code budget} - overall wall-clock budget of the retrieval fan-out (default 800ms)
 *   <li>{@code branch-budget} - per-branch sub-deadline inside the overall budget (default 750ms)
 *   <li>{@code candidate-multiplier} - each branch fetches {@code topK * multiplier} candidates
 *       before fusion (default 2, bounded [1, 10])
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "ragservice.search")
public class SearchProperties {

  private int rrfK = ReciprocalRankFusion.DEFAULT_K;
  private Duration budget = Duration.ofMillis(800);
  private Duration branchBudget = Duration.ofMillis(750);
  private int candidateMultiplier = 2;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (rrfK < 1) {
      throw new IllegalStateException("ragservice.search.rrf-k must be positive, got: " + rrfK);
    }
    if (budget == null || budget.isNegative() || budget.isZero()) {
      throw new IllegalStateException(
          "ragservice.search.budget must be positive, got: " + budget);
    }
    if (branchBudget == null
        || branchBudget.isNegative()
        || branchBudget.isZero()
        || branchBudget.compareTo(budget) > 0) {
      throw new IllegalStateException(
          "ragservice.search.branch-budget must be positive and not exceed budget ("
              + budget
              + "), got: "
              + branchBudget);
    }
    if (candidateMultiplier < 1 || candidateMultiplier > 10) {
      throw new IllegalStateException(
          "ragservice.search.candidate-multiplier must be in [1, 10], got: "
              + candidateMultiplier);
    }
  }

  public int getRrfK() {
    return rrfK;
  }

  public void setRrfK(int rrfK) {
    this.rrfK = rrfK;
  }

  public Duration getBudget() {
    return budget;
  }

  public void setBudget(Duration budget) {
    this.budget = budget;
  }

  public Duration getBranchBudget() {
    return branchBudget;
  }

  public void setBranchBudget(Duration branchBudget) {
    this.branchBudget = branchBudget;
  }

  public int getCandidateMultiplier() {
    return candidateMultiplier;
  }

  public void setCandidateMultiplier(int candidateMultiplier) {
    this.candidateMultiplier = candidateMultiplier;
  }
}
