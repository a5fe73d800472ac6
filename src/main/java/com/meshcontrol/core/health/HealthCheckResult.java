package com.meshcontrol.core.health;

import java.time.Instant;

/**
 * Latest health view of one endpoint.
 *
 * @param endpointId           endpoint URL
 * @param healthy              current health after hysteresis
 * @param latencyMs            latency of the last probe
 * @param lastChecked          time of the last probe, null before the first one
 * @param consecutiveFailures  failed probes in a row
 * @param consecutiveSuccesses passed probes in a row
 * @param lastError            message of the last failed probe (nullable)
 */
public record HealthCheckResult(
    String endpointId,
    boolean healthy,
    long latencyMs,
    Instant lastChecked,
    int consecutiveFailures,
    int consecutiveSuccesses,
    String lastError
) {

    static HealthCheckResult initial(String endpointId) {
        return new HealthCheckResult(endpointId, true, 0, null, 0, 0, null);
    }
}
