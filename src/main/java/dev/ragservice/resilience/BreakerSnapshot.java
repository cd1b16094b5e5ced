package dev.ragservice.resilience;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of a {@link CircuitBreaker}, used for health reporting and logging.
 *
 * @param name the dependency the breaker guards
 * @param state the current state
 * @param consecutiveFailures failures counted since the last success or transition
 * @param lastTransition when the breaker last changed state
 * @param failureThreshold consecutive failures that open the breaker
 * @param cooldown time spent OPEN before a trial call is allowed
 */
public record BreakerSnapshot(
    String name,
    BreakerState state,
    int consecutiveFailures,
    Instant lastTransition,
    int failureThreshold,
    Duration cooldown) {}
