package com.meshcontrol.core.ratelimit;

/**
 * Rate-limiting algorithms a rule can bind to a resource.
 */
public enum RateLimitAlgorithm {

    /**
     * Bucket of {@code capacity} tokens refilled continuously at {@code refillPerSecond}.
     * Allows bursts up to the capacity.
     */
    TOKEN_BUCKET,

    /**
     * At most {@code limit} accepted units within any trailing {@code window}.
     * Exact, at the cost of one timestamp per accepted unit.
     */
    SLIDING_WINDOW
}
