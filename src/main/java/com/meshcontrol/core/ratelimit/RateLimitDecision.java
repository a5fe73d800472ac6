package com.meshcontrol.core.ratelimit;

/**
 * Outcome of a rate-limit check.
 *
 * @param allowed          whether the call may proceed
 * @param ruleName         rule that decided, or null when no rule matched
 * @param remaining        units still available after this decision; -1 when unlimited
 * @param retryAfterMillis wait before the same request could pass; 0 when allowed
 */
public record RateLimitDecision(
    boolean allowed,
    String ruleName,
    long remaining,
    long retryAfterMillis
) {

    private static final RateLimitDecision UNLIMITED = new RateLimitDecision(true, null, -1, 0);

    public static RateLimitDecision unlimited() {
        return UNLIMITED;
    }

    public boolean isLimited() {
        return ruleName != null;
    }
}
