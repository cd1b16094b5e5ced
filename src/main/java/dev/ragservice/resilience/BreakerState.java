package dev.ragservice.resilience;

/** Lifecycle states of a {@link CircuitBreaker}. */
public enum BreakerState {

  /** Calls pass through; consecutive failures are counted. */
  CLOSED,

  /** Calls are rejected without being attempted until the cooldown elapses. */
  OPEN,

  /** A single trial call is admitted; its outcome decides between CLOSED and OPEN. */
  HALF_OPEN
}
