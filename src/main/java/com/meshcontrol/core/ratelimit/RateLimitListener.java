package com.meshcontrol.core.ratelimit;

/**
 * Notified of every rejected call.
 */
@FunctionalInterface
public interface RateLimitListener {

    RateLimitListener NO_OP = (clientKey, resourceKey, decision) -> { };

    void onRejected(String clientKey, String resourceKey, RateLimitDecision decision);
}
