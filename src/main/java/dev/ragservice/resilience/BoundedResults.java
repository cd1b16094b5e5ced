package dev.ragservice.resilience;

import java.util.List;
import java.util.NoSuchElementException;

/**
 * Outcomes of one {@link DeadlineGuard#runBounded} invocation, in submission order.
 *
 * @param outcomes one outcome per submitted call
 * @param elapsedMillis wall-clock time spent waiting for all calls
 */
public record BoundedResults<T>(List<Outcome<T>> outcomes, double elapsedMillis) {

  public BoundedResults {
    outcomes = List.copyOf(outcomes);
  }

  public Outcome<T> outcome(String name) {
    return outcomes.stream()
        .filter(o -> o.name().equals(name))
        .findFirst()
        .orElseThrow(() -> new NoSuchElementException("No bounded call named " + name));
  }

  /** {@code false} when no call completed: every call failed or timed out. */
  public boolean hasUsableResult() {
    return outcomes.stream().anyMatch(Outcome::isCompleted);
  }
}
