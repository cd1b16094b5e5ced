package dev.ragservice.resilience;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-dependency circuit breaker with CLOSED, OPEN and HALF_OPEN states.
 *
 * <p>The breaker opens after {@code failureThreshold} consecutive failures and rejects calls
 * without attempting them until {@code cooldown} has elapsed. The first permission request after
 * the cooldown moves it to HALF_OPEN, where exactly one trial call is admitted and every other call
 * fails fast. The trial's outcome closes the breaker or re-opens it for another cooldown.
 *
 * <p>All state changes happen under a single monitor. Every transition bumps a generation counter;
 * a {@link Permit} remembers the generation it was issued in, and outcomes reported against an
 * older generation are ignored. A burst of late results from calls admitted before the breaker
 * opened therefore cannot close it again or count twice.
 *
 * <p>Instances are long-lived and shared by all requests (see {@link CircuitBreakerRegistry}).
 */
public class CircuitBreaker {

  private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

  private final String name;
  private final int failureThreshold;
  private final Duration cooldown;
  private final Clock clock;
  private final Object lock = new Object();

  private BreakerState state = BreakerState.CLOSED;
  private int consecutiveFailures;
  private Instant lastTransition;
  private long generation;
  private boolean trialInFlight;

  public CircuitBreaker(String name, int failureThreshold, Duration cooldown, Clock clock) {
    if (failureThreshold < 1) {
      throw new IllegalArgumentException("failureThreshold must be at least 1");
    }
    if (cooldown.isNegative() || cooldown.isZero()) {
      throw new IllegalArgumentException("cooldown must be positive");
    }
    this.name = name;
    this.failureThreshold = failureThreshold;
    this.cooldown = cooldown;
    this.clock = clock;
    this.lastTransition = clock.instant();
  }

  /**
   * Runs the operation if the breaker admits it and records the outcome.
   *
   * <p>A call whose thread was interrupted while it ran (its deadline cancelled it) is recorded as a
   * failure even when the operation returned normally.
   *
   * @param operation the guarded call
   * @return the operation's result
   * @throws CircuitOpenException if the breaker rejected the call without attempting it
   */
  public <T> T execute(Supplier<T> operation) {
    Permit permit = tryAcquire().orElseThrow(() -> new CircuitOpenException(name));
    return runWith(permit, operation);
  }

  <T> T runWith(Permit permit, Supplier<T> operation) {
    try {
      T result = operation.get();
      if (Thread.currentThread().isInterrupted()) {
        permit.recordFailure(new InterruptedException("call to '" + name + "' was cancelled"));
      } else {
        permit.recordSuccess();
      }
      return result;
    } catch (RuntimeException e) {
      permit.recordFailure(e);
      throw e;
    } finally {
      permit.release();
    }
  }

  /**
   * Requests permission for a call whose outcome is reported later, e.g. a streamed response.
   *
   * @return a permit to complete exactly once, or empty if the call must fail fast
   */
  public Optional<Permit> tryAcquire() {
    synchronized (lock) {
      Instant now = clock.instant();
      advanceIfCooledDown(now);
      if (state == BreakerState.CLOSED) {
        return Optional.of(new Permit(generation, false));
      }
      if (state == BreakerState.HALF_OPEN && !trialInFlight) {
        trialInFlight = true;
        log.debug("Circuit breaker '{}' admitted trial call", name);
        return Optional.of(new Permit(generation, true));
      }
      return Optional.empty();
    }
  }

  /** Returns the current state, applying a pending cooldown transition. */
  public BreakerState state() {
    synchronized (lock) {
      advanceIfCooledDown(clock.instant());
      return state;
    }
  }

  public BreakerSnapshot snapshot() {
    synchronized (lock) {
      advanceIfCooledDown(clock.instant());
      return new BreakerSnapshot(
          name, state, consecutiveFailures, lastTransition, failureThreshold, cooldown);
    }
  }

  public String name() {
    return name;
  }

  private void onSuccess(Permit permit) {
    synchronized (lock) {
      if (permit.generation != generation) {
        return;
      }
      if (state == BreakerState.HALF_OPEN && permit.trial) {
        transitionTo(BreakerState.CLOSED, clock.instant());
        log.info("Circuit breaker '{}' closed after successful trial call", name);
      } else if (state == BreakerState.CLOSED) {
        consecutiveFailures = 0;
      }
    }
  }

  private void onFailure(Permit permit, Throwable cause) {
    synchronized (lock) {
      if (permit.generation != generation) {
        return;
      }
      if (state == BreakerState.HALF_OPEN && permit.trial) {
        transitionTo(BreakerState.OPEN, clock.instant());
        log.warn(
            "Circuit breaker '{}' re-opened after failed trial call: {}", name, describe(cause));
      } else if (state == BreakerState.CLOSED) {
        consecutiveFailures++;
        if (consecutiveFailures >= failureThreshold) {
          int failures = consecutiveFailures;
          transitionTo(BreakerState.OPEN, clock.instant());
          consecutiveFailures = failures;
          log.warn(
              "Circuit breaker '{}' opened after {} consecutive failures, last: {}",
              name,
              failures,
              describe(cause));
        }
      }
    }
  }

  private void onRelease(Permit permit) {
    synchronized (lock) {
      if (permit.generation == generation && permit.trial && state == BreakerState.HALF_OPEN) {
        trialInFlight = false;
      }
    }
  }

  private void advanceIfCooledDown(Instant now) {
    if (state == BreakerState.OPEN && !now.isBefore(lastTransition.plus(cooldown))) {
      transitionTo(BreakerState.HALF_OPEN, now);
      log.info("Circuit breaker '{}' half-open after {} cooldown", name, cooldown);
    }
  }

  private void transitionTo(BreakerState next, Instant now) {
    state = next;
    lastTransition = now;
    generation++;
    consecutiveFailures = 0;
    trialInFlight = false;
  }

  private static String describe(Throwable cause) {
    return cause.getClass().getSimpleName() + ": " + cause.getMessage();
  }

  /**
   * Admission ticket for one call. Exactly one of {@link #recordSuccess()}, {@link
   * #recordFailure(Throwable)} or {@link #release()} takes effect; later calls are no-ops.
   */
  public final class Permit {

    private final long generation;
    private final boolean trial;
    private final AtomicBoolean completed = new AtomicBoolean();

    private Permit(long generation, boolean trial) {
      this.generation = generation;
      this.trial = trial;
    }

    /** Whether this permit is the single trial call of a HALF_OPEN breaker. */
    public boolean isTrial() {
      return trial;
    }

    public void recordSuccess() {
      if (completed.compareAndSet(false, true)) {
        onSuccess(this);
      }
    }

    public void recordFailure(Throwable cause) {
      if (completed.compareAndSet(false, true)) {
        onFailure(this, cause);
      }
    }

    /** Gives the permit back without counting an outcome, freeing a HALF_OPEN trial slot. */
    public void release() {
      if (completed.compareAndSet(false, true)) {
        onRelease(this);
      }
    }
  }
}
