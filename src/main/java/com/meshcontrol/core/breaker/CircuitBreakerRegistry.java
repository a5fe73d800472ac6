package com.meshcontrol.core.breaker;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-endpoint circuit breakers, created lazily on first use.
 * <p>
 * {@link ConcurrentHashMap#computeIfAbsent} makes get-or-create atomic, so concurrent
 * first access to an endpoint never produces two breakers. Queries for an endpoint that
 * has no breaker yet answer as if it were CLOSED, without creating one.
 */
public class CircuitBreakerRegistry {

    private final ConcurrentHashMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final CircuitBreakerListener listener;

    public CircuitBreakerRegistry(CircuitBreakerConfig config, Clock clock, CircuitBreakerListener listener) {
        this.config = config;
        this.clock = clock;
        this.listener = listener == null ? CircuitBreakerListener.NO_OP : listener;
    }

    public CircuitBreaker breaker(String endpointId) {
        return breakers.computeIfAbsent(endpointId, id -> new CircuitBreaker(id, config, clock, listener));
    }

    public boolean mayPass(String endpointId) {
        return breaker(endpointId).mayPass();
    }

    /** Non-consuming check used to build the balancer's candidate set. */
    public boolean isCallPermitted(String endpointId) {
        CircuitBreaker breaker = breakers.get(endpointId);
        return breaker == null || breaker.isCallPermitted();
    }

    public void recordSuccess(String endpointId) {
        breaker(endpointId).recordSuccess();
    }

    public void recordFailure(String endpointId) {
        breaker(endpointId).recordFailure();
    }

    public void releasePermit(String endpointId) {
        CircuitBreaker breaker = breakers.get(endpointId);
        if (breaker != null) {
            breaker.releasePermit();
        }
    }

    public CircuitState getState(String endpointId) {
        CircuitBreaker breaker = breakers.get(endpointId);
        return breaker == null ? CircuitState.CLOSED : breaker.getState();
    }

    public Optional<CircuitBreakerState> snapshot(String endpointId) {
        return Optional.ofNullable(breakers.get(endpointId)).map(CircuitBreaker::snapshot);
    }

    public Duration retryAfter(String endpointId) {
        CircuitBreaker breaker = breakers.get(endpointId);
        return breaker == null ? Duration.ZERO : breaker.retryAfter();
    }

    public void remove(String endpointId) {
        breakers.remove(endpointId);
    }

    public void removeAll(Collection<String> endpointIds) {
        endpointIds.forEach(breakers::remove);
    }

    /** Number of breakers currently OPEN. HALF_OPEN breakers are not counted. */
    public int openCount() {
        int open = 0;
        for (CircuitBreaker breaker : breakers.values()) {
            if (breaker.getState() == CircuitState.OPEN) {
                open++;
            }
        }
        return open;
    }

    public List<CircuitBreakerState> snapshots() {
        var result = new ArrayList<CircuitBreakerState>(breakers.size());
        for (CircuitBreaker breaker : breakers.values()) {
            result.add(breaker.snapshot());
        }
        return result;
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    public int size() {
        return breakers.size();
    }
}
