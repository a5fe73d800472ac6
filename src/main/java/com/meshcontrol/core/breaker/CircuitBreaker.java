package com.meshcontrol.core.breaker;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Failure/success state machine guarding a single endpoint.
 * <p>
 * All mutations happen under a per-breaker lock, so transitions for one endpoint are
 * totally ordered and a burst of concurrent failures opens the breaker exactly once.
 * State fields are volatile so {@link #isCallPermitted()} and {@link #getState()} can
 * read without locking. Listeners are notified after the lock is released.
 */
public class CircuitBreaker {

    private final String endpointId;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final CircuitBreakerListener listener;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile CircuitState state = CircuitState.CLOSED;
    private volatile int consecutiveFailures;
    private volatile int consecutiveSuccesses;
    private volatile Instant lastTransitionTime;
    private volatile Instant openedUntil;
    private volatile Duration currentOpenTimeout;
    private volatile int halfOpenInFlight;
    private int reopenCount;

    public CircuitBreaker(String endpointId, CircuitBreakerConfig config, Clock clock,
                          CircuitBreakerListener listener) {
        this.endpointId = endpointId;
        this.config = config;
        this.clock = clock;
        this.listener = listener == null ? CircuitBreakerListener.NO_OP : listener;
        this.lastTransitionTime = clock.instant();
        this.currentOpenTimeout = config.openTimeout();
    }

    /**
     * Asks for permission to send one call. Moves an expired OPEN breaker to HALF_OPEN
     * and takes a probe permit while HALF_OPEN; the permit is returned by the next
     * {@link #recordSuccess()} or {@link #recordFailure()}.
     */
    public boolean mayPass() {
        if (state == CircuitState.CLOSED) {
            return true;
        }
        Transition transition = null;
        boolean permitted;
        lock.lock();
        try {
            switch (state) {
                case CLOSED -> permitted = true;
                case OPEN -> {
                    if (clock.instant().isBefore(openedUntil)) {
                        permitted = false;
                    } else {
                        transition = transitionTo(CircuitState.HALF_OPEN);
                        halfOpenInFlight = 1;
                        permitted = true;
                    }
                }
                case HALF_OPEN -> {
                    if (halfOpenInFlight < config.halfOpenMaxCalls()) {
                        halfOpenInFlight++;
                        permitted = true;
                    } else {
                        permitted = false;
                    }
                }
                default -> throw new IllegalStateException("Unknown state " + state);
            }
        } finally {
            lock.unlock();
        }
        fire(transition);
        return permitted;
    }

    /**
     * Whether {@link #mayPass()} would currently admit a call, without taking a permit or
     * changing state.
     */
    public boolean isCallPermitted() {
        return switch (state) {
            case CLOSED -> true;
            case OPEN -> {
                Instant until = openedUntil;
                yield until == null || !clock.instant().isBefore(until);
            }
            case HALF_OPEN -> halfOpenInFlight < config.halfOpenMaxCalls();
        };
    }

    public void recordSuccess() {
        Transition transition = null;
        lock.lock();
        try {
            switch (state) {
                case CLOSED -> {
                    consecutiveFailures = 0;
                    consecutiveSuccesses++;
                }
                case HALF_OPEN -> {
                    releaseProbe();
                    consecutiveFailures = 0;
                    consecutiveSuccesses++;
                    if (consecutiveSuccesses >= config.successThreshold()) {
                        transition = transitionTo(CircuitState.CLOSED);
                    }
                }
                case OPEN -> {
                    // late result of a call admitted before the breaker opened
                }
            }
        } finally {
            lock.unlock();
        }
        fire(transition);
    }

    public void recordFailure() {
        Transition transition = null;
        lock.lock();
        try {
            switch (state) {
                case CLOSED -> {
                    consecutiveSuccesses = 0;
                    consecutiveFailures++;
                    if (consecutiveFailures >= config.failureThreshold()) {
                        reopenCount = 0;
                        transition = open();
                    }
                }
                case HALF_OPEN -> {
                    releaseProbe();
                    consecutiveSuccesses = 0;
                    consecutiveFailures++;
                    reopenCount++;
                    transition = open();
                }
                case OPEN -> consecutiveFailures++;
            }
        } finally {
            lock.unlock();
        }
        fire(transition);
    }

    /**
     * Returns a permit taken by {@link #mayPass()} for a call that was never sent, so the
     * outcome neither counts as a success nor a failure.
     */
    public void releasePermit() {
        lock.lock();
        try {
            if (state == CircuitState.HALF_OPEN) {
                releaseProbe();
            }
        } finally {
            lock.unlock();
        }
    }

    public CircuitState getState() {
        return state;
    }

    public String getEndpointId() {
        return endpointId;
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    /** Time left until an OPEN breaker admits a probe; zero in any other state. */
    public Duration retryAfter() {
        Instant until = openedUntil;
        if (state != CircuitState.OPEN || until == null) {
            return Duration.ZERO;
        }
        Duration left = Duration.between(clock.instant(), until);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public CircuitBreakerState snapshot() {
        lock.lock();
        try {
            return new CircuitBreakerState(endpointId, state, consecutiveFailures, consecutiveSuccesses,
                    lastTransitionTime, state == CircuitState.OPEN ? openedUntil : null, currentOpenTimeout);
        } finally {
            lock.unlock();
        }
    }

    private Transition open() {
        currentOpenTimeout = config.openTimeoutFor(reopenCount);
        Transition transition = transitionTo(CircuitState.OPEN);
        openedUntil = lastTransitionTime.plus(currentOpenTimeout);
        return transition;
    }

    private void releaseProbe() {
        if (halfOpenInFlight > 0) {
            halfOpenInFlight--;
        }
    }

    // Caller holds the lock.
    private Transition transitionTo(CircuitState next) {
        CircuitState previous = state;
        if (!previous.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal breaker transition " + previous + " -> " + next
                    + " for " + endpointId);
        }
        state = next;
        lastTransitionTime = clock.instant();
        switch (next) {
            case CLOSED -> {
                consecutiveFailures = 0;
                consecutiveSuccesses = 0;
                halfOpenInFlight = 0;
                reopenCount = 0;
                openedUntil = null;
            }
            case HALF_OPEN -> {
                consecutiveSuccesses = 0;
                halfOpenInFlight = 0;
            }
            case OPEN -> halfOpenInFlight = 0;
        }
        return new Transition(previous, next);
    }

    private void fire(Transition transition) {
        if (transition != null) {
            listener.onTransition(transition.from(), transition.to(), snapshot());
        }
    }

    private record Transition(CircuitState from, CircuitState to) {}
}
