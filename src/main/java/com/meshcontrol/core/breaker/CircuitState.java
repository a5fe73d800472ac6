package com.meshcontrol.core.breaker;

/**
 * States of a per-endpoint circuit breaker.
 * <p>
 * Legal transitions: CLOSED → OPEN → HALF_OPEN → (CLOSED | OPEN). HALF_OPEN is never skipped.
 */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN;

    public boolean canTransitionTo(CircuitState next) {
        return switch (this) {
            case CLOSED -> next == OPEN;
            case OPEN -> next == HALF_OPEN;
            case HALF_OPEN -> next == CLOSED || next == OPEN;
        };
    }
}
