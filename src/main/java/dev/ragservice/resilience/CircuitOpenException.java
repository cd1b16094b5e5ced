package dev.ragservice.resilience;

/** Thrown when a call is rejected by an OPEN (or busy HALF_OPEN) {@link CircuitBreaker}. */
public class CircuitOpenException extends RuntimeException {

  private final String dependency;

  public CircuitOpenException(String dependency) {
    super("Circuit breaker '" + dependency + "' is open");
    this.dependency = dependency;
  }

  public String getDependency() {
    return dependency;
  }
}
