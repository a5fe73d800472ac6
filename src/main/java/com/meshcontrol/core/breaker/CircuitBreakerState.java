package com.meshcontrol.core.breaker;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of one endpoint's breaker.
 *
 * @param endpointId           endpoint the breaker guards
 * @param state                current state
 * @param consecutiveFailures  failures since the last success
 * @param consecutiveSuccesses successes since the last failure or state change
 * @param lastTransitionTime   when the breaker last changed state
 * @param openedUntil          end of the current open period; null unless OPEN
 * @param openTimeout          length of the current (or last) open period
 */
public record CircuitBreakerState(
    String endpointId,
    CircuitState state,
    int consecutiveFailures,
    int consecutiveSuccesses,
    Instant lastTransitionTime,
    Instant openedUntil,
    Duration openTimeout
) {}
