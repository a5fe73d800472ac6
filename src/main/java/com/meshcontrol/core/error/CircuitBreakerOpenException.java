package com.meshcontrol.core.error;

import java.time.Duration;

/**
 * Thrown when healthy endpoints exist but every one of them has an open circuit.
 * The caller may retry after {@link #getRetryAfter()}.
 */
public class CircuitBreakerOpenException extends ServiceUnavailableException {

    private final Duration retryAfter;

    public CircuitBreakerOpenException(String serviceId, Duration retryAfter) {
        super(serviceId, "All circuits open for service: " + serviceId);
        this.retryAfter = retryAfter == null ? Duration.ZERO : retryAfter;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
