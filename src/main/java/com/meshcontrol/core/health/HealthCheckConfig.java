package com.meshcontrol.core.health;

import com.meshcontrol.core.error.InvalidServiceConfigurationException;

import java.time.Duration;

/**
 * Probe schedule and hysteresis thresholds.
 *
 * @param interval           delay between probes of one endpoint
 * @param probeTimeout       timeout handed to the probe
 * @param unhealthyThreshold consecutive failures that mark an endpoint unhealthy
 * @param healthyThreshold   consecutive successes that mark it healthy again
 */
public record HealthCheckConfig(
    Duration interval,
    Duration probeTimeout,
    int unhealthyThreshold,
    int healthyThreshold
) {

    public static final HealthCheckConfig DEFAULT =
            new HealthCheckConfig(Duration.ofSeconds(30), Duration.ofSeconds(2), 3, 2);

    public HealthCheckConfig {
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new InvalidServiceConfigurationException("health-check interval must be positive");
        }
        if (probeTimeout == null || probeTimeout.isNegative() || probeTimeout.isZero()) {
            throw new InvalidServiceConfigurationException("probe timeout must be positive");
        }
        if (unhealthyThreshold < 1) {
            throw new InvalidServiceConfigurationException("unhealthyThreshold must be >= 1");
        }
        if (healthyThreshold < 1) {
            throw new InvalidServiceConfigurationException("healthyThreshold must be >= 1");
        }
    }
}
