package com.meshcontrol.core.model;

/**
 * Aggregate health of a service, derived from the health of its endpoints.
 */
public enum ServiceHealth {
    /** Every endpoint is healthy. */
    HEALTHY,
    /** Some, but not all, endpoints are healthy. */
    DEGRADED,
    /** No endpoint is healthy. */
    UNHEALTHY,
    /** The service has no endpoints or no checks have been recorded. */
    UNKNOWN;

    public static ServiceHealth of(int healthyEndpoints, int totalEndpoints) {
        if (totalEndpoints <= 0) return UNKNOWN;
        if (healthyEndpoints >= totalEndpoints) return HEALTHY;
        if (healthyEndpoints == 0) return UNHEALTHY;
        return DEGRADED;
    }
}
