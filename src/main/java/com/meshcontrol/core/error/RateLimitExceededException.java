package com.meshcontrol.core.error;

/**
 * Thrown by the invoke path when a client exceeded the rate limit for a resource.
 */
public class RateLimitExceededException extends MeshException {

    private final String clientKey;
    private final String resourceKey;
    private final long retryAfterMillis;

    public RateLimitExceededException(String clientKey, String resourceKey, long retryAfterMillis) {
        super("Rate limit exceeded for client " + clientKey + " on " + resourceKey);
        this.clientKey = clientKey;
        this.resourceKey = resourceKey;
        this.retryAfterMillis = retryAfterMillis;
    }

    public String getClientKey() {
        return clientKey;
    }

    public String getResourceKey() {
        return resourceKey;
    }

    public long getRetryAfterMillis() {
        return retryAfterMillis;
    }
}
