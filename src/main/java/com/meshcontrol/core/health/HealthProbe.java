package com.meshcontrol.core.health;

import com.meshcontrol.core.error.HealthCheckException;
import com.meshcontrol.core.model.ServiceEndpoint;

import java.time.Duration;

/**
 * Performs one liveness check against an endpoint.
 */
@FunctionalInterface
public interface HealthProbe {

    /**
     * Probes {@code endpoint}, giving up after {@code timeout}.
     *
     * @return whether the endpoint answered as healthy
     * @throws HealthCheckException if the probe could not be completed
     */
    boolean probe(ServiceEndpoint endpoint, Duration timeout);
}
