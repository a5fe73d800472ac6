package com.meshcontrol.core.ratelimit;

/**
 * Identity of one limiter entry.
 */
public record RateLimitKey(String clientKey, String resourceKey) {}
