package dev.ragservice.api;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.ragservice.document.DocumentIndex;
import dev.ragservice.resilience.BreakerSnapshot;
import dev.ragservice.resilience.BreakerState;
import dev.ragservice.resilience.CircuitBreaker;
import dev.ragservice.resilience.CircuitBreakerRegistry;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness and dependency overview. Reports {@code degraded} when the index is unreachable, the
 * embedding model is unusable, or any circuit breaker is not closed.
 */
@RestController
public class HealthController {

  private static final Logger log = LoggerFactory.getLogger(HealthController.class);

  private final DocumentIndex documentIndex;
  private final EmbeddingModel embeddingModel;
  private final CircuitBreakerRegistry breakers;

  public HealthController(
      DocumentIndex documentIndex, EmbeddingModel embeddingModel, CircuitBreakerRegistry breakers) {
    this.documentIndex = documentIndex;
    this.embeddingModel = embeddingModel;
    this.breakers = breakers;
  }

  @GetMapping("/health")
  public HealthResponse health() {
    boolean indexReachable = documentIndex.isReachable();
    boolean modelLoaded = embeddingModelLoaded();

    Map<String, HealthResponse.BreakerStatus> breakerStatus = new LinkedHashMap<>();
    boolean allClosed = true;
    for (CircuitBreaker breaker : breakers.all()) {
      BreakerSnapshot snapshot = breaker.snapshot();
      allClosed &= snapshot.state() == BreakerState.CLOSED;
      breakerStatus.put(
          snapshot.name(),
          new HealthResponse.BreakerStatus(
              snapshot.state().name(),
              snapshot.consecutiveFailures(),
              snapshot.lastTransition().toString()));
    }

    String status = indexReachable && modelLoaded && allClosed ? "healthy" : "degraded";
    return new HealthResponse(status, indexReachable, modelLoaded, breakerStatus);
  }

  private boolean embeddingModelLoaded() {
    try {
      return embeddingModel.dimension() > 0;
    } catch (RuntimeException e) {
      log.warn("Embedding model unavailable: {}", e.getMessage());
      return false;
    }
  }
}
