package com.meshcontrol.core.ratelimit;

/**
 * Mutable limiter state for one (client, resource) pair, reading time from the clock it
 * was created with. Not thread-safe by itself; {@link RateLimiter} serialises access per
 * entry.
 */
interface RateLimitState {

    /** Consumes {@code cost} units if the budget allows it. A rejection consumes nothing. */
    boolean tryAcquire(int cost);

    /** Units that could be acquired right now. */
    long remaining();

    /** Milliseconds until {@code cost} units become available; {@code Long.MAX_VALUE} if never. */
    long retryAfterMillis(int cost);

    RateLimitRule rule();
}
