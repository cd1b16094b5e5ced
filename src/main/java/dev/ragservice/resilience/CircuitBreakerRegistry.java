package dev.ragservice.resilience;

import java.time.Clock;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Owns the process-wide circuit breakers, one per downstream dependency. Created once at startup
 * and injected wherever a dependency is called.
 */
@Component
public class CircuitBreakerRegistry {

  public static final String VECTOR_STORE = "vector-store";
  public static final String GENERATION = "generation";

  private final CircuitBreaker vectorStore;
  private final CircuitBreaker generation;

  public CircuitBreakerRegistry(ResilienceProperties properties, Clock clock) {
    this.vectorStore = create(VECTOR_STORE, properties.getVectorStore(), clock);
    this.generation = create(GENERATION, properties.getGeneration(), clock);
  }

  /** Breaker shared by the dense and sparse retrieval calls. */
  public CircuitBreaker vectorStore() {
    return vectorStore;
  }

  /** Breaker in front of the generative summary backend. */
  public CircuitBreaker generation() {
    return generation;
  }

  public List<CircuitBreaker> all() {
    return List.of(vectorStore, generation);
  }

  private static CircuitBreaker create(
      String name, ResilienceProperties.Breaker settings, Clock clock) {
    return new CircuitBreaker(
        name, settings.getFailureThreshold(), settings.getCooldown(), clock);
  }
}
