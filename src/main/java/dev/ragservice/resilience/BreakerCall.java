package dev.ragservice.resilience;

import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;

/**
 * One circuit-breaker-protected call that can be abandoned from another thread.
 *
 * <p>The worker runs the call with {@link #execute}; whoever gives up on it (normally the
 * {@link DeadlineGuard} at the call's deadline) invokes {@link #abandon()}. Abandoning a call that
 * holds a permit records a failure right away, so a HALF_OPEN trial stuck in I/O that ignores
 * interrupts re-opens the breaker at its deadline and a store that is merely slow still counts
 * towards the failure threshold. Whatever the worker reports later is ignored, since a permit
 * settles once. A call abandoned before it acquired a permit never acquires one.
 */
public final class BreakerCall {

  private final CircuitBreaker breaker;
  private final Object lock = new Object();

  private CircuitBreaker.@Nullable Permit permit;
  private boolean abandoned;

  public BreakerCall(CircuitBreaker breaker) {
    this.breaker = breaker;
  }

  /**
   * Acquires a permit and runs the operation, recording its outcome on the breaker.
   *
   * @throws CircuitOpenException if the breaker rejected the call without attempting it
   * @throws CancellationException if the call was abandoned before it started
   */
  public <T> T execute(Supplier<T> operation) {
    CircuitBreaker.Permit acquired;
    synchronized (lock) {
      if (abandoned) {
        throw new CancellationException("call to '" + breaker.name() + "' was abandoned");
      }
      acquired =
          breaker.tryAcquire().orElseThrow(() -> new CircuitOpenException(breaker.name()));
      permit = acquired;
    }
    return breaker.runWith(acquired, operation);
  }

  /** Settles a held permit as a failure and prevents a later start. Idempotent. */
  public void abandon() {
    CircuitBreaker.Permit held;
    synchronized (lock) {
      if (abandoned) {
        return;
      }
      abandoned = true;
      held = permit;
    }
    if (held != null) {
      held.recordFailure(
          new TimeoutException("call to '" + breaker.name() + "' exceeded its deadline"));
    }
  }
}
