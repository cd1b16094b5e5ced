package dev.ragservice.resilience;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised circuit breaker settings, one block per guarded dependency.
 *
 * <p>Bound from {@code ragservice.resilience.*}:
 *
 * <ul>
 *   <li>{@code vector-store.failure-threshold} / {@code vector-store.cooldown} - breaker shared by
 *       the dense and sparse retrieval branches (defaults 3 and 30s)
 *   <li>{@code generation.failure-threshold} / {@code generation.cooldown} - breaker in front of
 *       the summary model (defaults 3 and 30s)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}.
 */
@Configuration
@ConfigurationProperties(prefix = "ragservice.resilience")
public class ResilienceProperties {

  private Breaker vectorStore = new Breaker();
  private Breaker generation = new Breaker();

  @PostConstruct
  void validate() {
    vectorStore.validate("vector-store");
    generation.validate("generation");
  }

  public Breaker getVectorStore() {
    return vectorStore;
  }

  public void setVectorStore(Breaker vectorStore) {
    this.vectorStore = vectorStore;
  }

  public Breaker getGeneration() {
    return generation;
  }

  public void setGeneration(Breaker generation) {
    this.generation = generation;
  }

  /** Threshold and cooldown of a single breaker. */
  public static class Breaker {

    private int failureThreshold = 3;
    private Duration cooldown = Duration.ofSeconds(30);

    void validate(String key) {
      if (failureThreshold < 1 || failureThreshold > 100) {
        throw new IllegalStateException(
            "ragservice.resilience."
                + key
                + ".failure-threshold must be in [1, 100], got: "
                + failureThreshold);
      }
      if (cooldown == null || cooldown.isNegative() || cooldown.isZero()) {
        throw new IllegalStateException(
            "ragservice.resilience." + key + ".cooldown must be positive, got: " + cooldown);
      }
    }

    public int getFailureThreshold() {
      return failureThreshold;
    }

    public void setFailureThreshold(int failureThreshold) {
      this.failureThreshold = failureThreshold;
    }

    public Duration getCooldown() {
      return cooldown;
    }

    public void setCooldown(Duration cooldown) {
      this.cooldown = cooldown;
    }
  }
}
