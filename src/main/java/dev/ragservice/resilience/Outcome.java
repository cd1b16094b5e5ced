package dev.ragservice.resilience;

import org.jspecify.annotations.Nullable;

/**
 * Result of one {@link BoundedCall}: its value, a timeout marker, or the failure it raised.
 *
 * @param name the call's label
 * @param status how the call ended
 * @param value the result when {@link Status#COMPLETED}
 * @param error the cause when {@link Status#FAILED}
 * @param elapsedMillis time from submission until the outcome was known
 */
public record Outcome<T>(
    String name,
    Status status,
    @Nullable T value,
    @Nullable Throwable error,
    double elapsedMillis) {

  /** Terminal status of a bounded call. */
  public enum Status {
    COMPLETED,
    TIMED_OUT,
    FAILED
  }

  static <T> Outcome<T> completed(String name, @Nullable T value, double elapsedMillis) {
    return new Outcome<>(name, Status.COMPLETED, value, null, elapsedMillis);
  }

  static <T> Outcome<T> timedOut(String name, double elapsedMillis) {
    return new Outcome<>(name, Status.TIMED_OUT, null, null, elapsedMillis);
  }

  static <T> Outcome<T> failed(String name, Throwable error, double elapsedMillis) {
    return new Outcome<>(name, Status.FAILED, null, error, elapsedMillis);
  }

  public boolean isCompleted() {
    return status == Status.COMPLETED;
  }

  public boolean isTimedOut() {
    return status == Status.TIMED_OUT;
  }

  public boolean isFailed() {
    return status == Status.FAILED;
  }

  /** Whether the call was rejected by an open circuit breaker rather than attempted. */
  public boolean isCircuitOpen() {
    return error instanceof CircuitOpenException;
  }

  /** Returns the value of a completed call, or {@code fallback} for any other outcome. */
  public T valueOr(T fallback) {
    T result = value;
    return status == Status.COMPLETED && result != null ? result : fallback;
  }

  /** Short description for logs and error messages, e.g. {@code "dense: timed out"}. */
  public String describe() {
    switch (status) {
      case COMPLETED:
        return name + ": completed";
      case TIMED_OUT:
        return name + ": timed out after " + Math.round(elapsedMillis) + "ms";
      default:
        Throwable cause = error;
        String detail =
            cause == null ? "unknown" : cause.getClass().getSimpleName() + ": " + cause.getMessage();
        return name + ": failed (" + detail + ")";
    }
  }
}
