package dev.ragservice.resilience;

import java.time.Duration;
import java.util.concurrent.Callable;
import org.jspecify.annotations.Nullable;

/**
 * One operation submitted to {@link DeadlineGuard#runBounded}.
 *
 * @param name label used in outcomes and logs
 * @param operation the work to run
 * @param subBudget optional per-call limit inside the overall budget; {@code null} uses the overall
 *     budget
 * @param onAbandon optional hook run on the awaiting thread when the guard gives up on the call
 *     (timeout or interrupted wait), whether or not the worker honours the interrupt
 */
public record BoundedCall<T>(
    String name,
    Callable<T> operation,
    @Nullable Duration subBudget,
    @Nullable Runnable onAbandon) {

  public BoundedCall {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("name must not be blank");
    }
    if (operation == null) {
      throw new IllegalArgumentException("operation must not be null");
    }
    if (subBudget != null && (subBudget.isNegative() || subBudget.isZero())) {
      throw new IllegalArgumentException("subBudget must be positive");
    }
  }

  public static <T> BoundedCall<T> of(String name, Callable<T> operation) {
    return new BoundedCall<>(name, operation, null, null);
  }

  public static <T> BoundedCall<T> of(String name, Callable<T> operation, Duration subBudget) {
    return new BoundedCall<>(name, operation, subBudget, null);
  }

  /** A call whose circuit-breaker permit is settled as a failure if the guard abandons it. */
  public static <T> BoundedCall<T> guarded(
      String name, Callable<T> operation, Duration subBudget, BreakerCall breakerCall) {
    return new BoundedCall<>(name, operation, subBudget, breakerCall::abandon);
  }
}
