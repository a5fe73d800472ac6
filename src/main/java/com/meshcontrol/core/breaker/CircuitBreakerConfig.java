package com.meshcontrol.core.breaker;

import com.meshcontrol.core.error.InvalidServiceConfigurationException;

import java.time.Duration;
import java.util.Locale;

/**
 * Validated breaker thresholds and timeouts.
 * <p>
 * Each consecutive re-opening from HALF_OPEN multiplies the open timeout by
 * {@code backoffMultiplier}, capped at {@code maxOpenTimeout}. Closing resets the backoff.
 *
 * @param failureThreshold  consecutive failures that open a closed breaker
 * @param successThreshold  consecutive half-open successes that close the breaker
 * @param openTimeout       base length of an open period
 * @param halfOpenMaxCalls  concurrent probe calls admitted while half-open
 * @param backoffMultiplier growth factor for repeated re-opening, at least 1.0
 * @param maxOpenTimeout    cap on the open period
 */
public record CircuitBreakerConfig(
    int failureThreshold,
    int successThreshold,
    Duration openTimeout,
    int halfOpenMaxCalls,
    double backoffMultiplier,
    Duration maxOpenTimeout
) {

    public static final Duration DEFAULT_MAX_OPEN_TIMEOUT = Duration.ofMinutes(5);
    public static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0;

    public static final CircuitBreakerConfig DEFAULT =
            new CircuitBreakerConfig(5, 3, Duration.ofSeconds(60), 1, DEFAULT_BACKOFF_MULTIPLIER, DEFAULT_MAX_OPEN_TIMEOUT);
    public static final CircuitBreakerConfig AGGRESSIVE =
            new CircuitBreakerConfig(3, 2, Duration.ofSeconds(30), 1, DEFAULT_BACKOFF_MULTIPLIER, DEFAULT_MAX_OPEN_TIMEOUT);
    public static final CircuitBreakerConfig CONSERVATIVE =
            new CircuitBreakerConfig(10, 5, Duration.ofSeconds(120), 1, DEFAULT_BACKOFF_MULTIPLIER, DEFAULT_MAX_OPEN_TIMEOUT);

    public CircuitBreakerConfig {
        if (failureThreshold <= 0) {
            throw new InvalidServiceConfigurationException("failureThreshold must be > 0, got " + failureThreshold);
        }
        if (successThreshold <= 0) {
            throw new InvalidServiceConfigurationException("successThreshold must be > 0, got " + successThreshold);
        }
        if (halfOpenMaxCalls <= 0) {
            throw new InvalidServiceConfigurationException("halfOpenMaxCalls must be > 0, got " + halfOpenMaxCalls);
        }
        if (openTimeout == null || openTimeout.isNegative() || openTimeout.isZero()) {
            throw new InvalidServiceConfigurationException("openTimeout must be positive, got " + openTimeout);
        }
        if (Double.isNaN(backoffMultiplier) || backoffMultiplier < 1.0) {
            throw new InvalidServiceConfigurationException("backoffMultiplier must be >= 1.0, got " + backoffMultiplier);
        }
        if (maxOpenTimeout == null) {
            maxOpenTimeout = openTimeout.compareTo(DEFAULT_MAX_OPEN_TIMEOUT) > 0 ? openTimeout : DEFAULT_MAX_OPEN_TIMEOUT;
        }
        if (maxOpenTimeout.compareTo(openTimeout) < 0) {
            throw new InvalidServiceConfigurationException(
                    "maxOpenTimeout " + maxOpenTimeout + " is shorter than openTimeout " + openTimeout);
        }
    }

    public static CircuitBreakerConfig of(int failureThreshold, int successThreshold, Duration openTimeout) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, openTimeout, 1,
                DEFAULT_BACKOFF_MULTIPLIER, null);
    }

    /**
     * Resolves a preset by name: {@code default}, {@code aggressive} or {@code conservative}.
     */
    public static CircuitBreakerConfig preset(String name) {
        if (name == null || name.isBlank()) return DEFAULT;
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "default" -> DEFAULT;
            case "aggressive" -> AGGRESSIVE;
            case "conservative" -> CONSERVATIVE;
            default -> throw new InvalidServiceConfigurationException("Unknown circuit breaker preset: " + name);
        };
    }

    /** Open period after {@code reopenCount} consecutive re-openings. */
    public Duration openTimeoutFor(int reopenCount) {
        if (reopenCount <= 0 || backoffMultiplier == 1.0) {
            return openTimeout;
        }
        double factor = Math.pow(backoffMultiplier, reopenCount);
        double millis = openTimeout.toMillis() * factor;
        if (Double.isInfinite(millis) || millis >= maxOpenTimeout.toMillis()) {
            return maxOpenTimeout;
        }
        return Duration.ofMillis((long) millis);
    }
}
