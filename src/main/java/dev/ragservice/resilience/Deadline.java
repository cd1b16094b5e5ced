package dev.ragservice.resilience;

import java.time.Duration;

/** A fixed point in monotonic time, for stages that consume a stream under a budget. */
public final class Deadline {

  private final long startNanos;
  private final long deadlineNanos;

  private Deadline(long startNanos, Duration budget) {
    this.startNanos = startNanos;
    this.deadlineNanos = startNanos + budget.toNanos();
  }

  static Deadline after(Duration budget) {
    return new Deadline(System.nanoTime(), budget);
  }

  /** Time left before expiry, never negative. */
  public Duration remaining() {
    long left = deadlineNanos - System.nanoTime();
    return left > 0 ? Duration.ofNanos(left) : Duration.ZERO;
  }

  public boolean isExpired() {
    return deadlineNanos - System.nanoTime() <= 0;
  }

  public double elapsedMillis() {
    return (System.nanoTime() - startNanos) / 1_000_000.0;
  }
}
