package com.meshcontrol.core.ratelimit;

import com.meshcontrol.core.error.InvalidServiceConfigurationException;

import java.time.Clock;
import java.time.Duration;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Binds resources whose key matches {@code resourcePattern} to one algorithm and its parameters.
 *
 * @param name            rule name, unique within a limiter
 * @param resourcePattern regular expression matched against the whole resource key
 * @param algorithm       algorithm to apply
 * @param capacity        token-bucket capacity
 * @param refillPerSecond token-bucket refill rate
 * @param limit           sliding-window limit
 * @param window          sliding-window length
 */
public record RateLimitRule(
    String name,
    String resourcePattern,
    RateLimitAlgorithm algorithm,
    int capacity,
    double refillPerSecond,
    int limit,
    Duration window
) {

    public RateLimitRule {
        if (name == null || name.isBlank()) {
            throw new InvalidServiceConfigurationException("Rate limit rule needs a name");
        }
        if (resourcePattern == null || resourcePattern.isBlank()) {
            resourcePattern = ".*";
        }
        try {
            Pattern.compile(resourcePattern);
        } catch (PatternSyntaxException e) {
            throw new InvalidServiceConfigurationException(
                    "Rule " + name + " has an invalid resource pattern: " + e.getDescription());
        }
        if (algorithm == null) {
            throw new InvalidServiceConfigurationException("Rule " + name + " needs an algorithm");
        }
        switch (algorithm) {
            case TOKEN_BUCKET -> {
                if (capacity <= 0) {
                    throw new InvalidServiceConfigurationException(
                            "Rule " + name + ": capacity must be > 0, got " + capacity);
                }
                if (!(refillPerSecond > 0) || Double.isInfinite(refillPerSecond)) {
                    throw new InvalidServiceConfigurationException(
                            "Rule " + name + ": refillPerSecond must be > 0, got " + refillPerSecond);
                }
            }
            case SLIDING_WINDOW -> {
                if (limit <= 0) {
                    throw new InvalidServiceConfigurationException(
                            "Rule " + name + ": limit must be > 0, got " + limit);
                }
                if (window == null || window.isNegative() || window.toMillis() <= 0) {
                    throw new InvalidServiceConfigurationException(
                            "Rule " + name + ": window must be at least 1ms, got " + window);
                }
            }
        }
    }

    public static RateLimitRule tokenBucket(String name, String resourcePattern, int capacity, double refillPerSecond) {
        return new RateLimitRule(name, resourcePattern, RateLimitAlgorithm.TOKEN_BUCKET,
                capacity, refillPerSecond, 0, null);
    }

    public static RateLimitRule slidingWindow(String name, String resourcePattern, int limit, Duration window) {
        return new RateLimitRule(name, resourcePattern, RateLimitAlgorithm.SLIDING_WINDOW,
                0, 0, limit, window);
    }

    /**
     * How long an untouched entry must be kept. After this, its state is equivalent to a
     * fresh one (a full bucket, an empty window), so expiring it loses nothing.
     */
    public Duration idleTtl() {
        return switch (algorithm) {
            case TOKEN_BUCKET -> Duration.ofMillis((long) Math.ceil(capacity * 1000.0 / refillPerSecond) + 1);
            case SLIDING_WINDOW -> window.plusMillis(1);
        };
    }

    RateLimitState newState(Clock clock) {
        return switch (algorithm) {
            case TOKEN_BUCKET -> new TokenBucket(this, clock);
            case SLIDING_WINDOW -> new SlidingWindow(this, clock);
        };
    }
}
