package com.meshcontrol.core.health;

/**
 * Read side of endpoint health, as consumed by the load balancer.
 */
@FunctionalInterface
public interface HealthView {

    boolean isHealthy(String endpointId);
}
