package com.meshcontrol.core.breaker;

/**
 * Receives every breaker state transition. Called outside the breaker's lock.
 */
@FunctionalInterface
public interface CircuitBreakerListener {

    CircuitBreakerListener NO_OP = (from, to, state) -> { };

    void onTransition(CircuitState from, CircuitState to, CircuitBreakerState state);
}
