package com.meshcontrol.core.health;

import com.meshcontrol.core.model.ServiceEndpoint;

/**
 * Callbacks from the health checker. Invoked on the probing thread.
 */
public interface HealthCheckListener {

    HealthCheckListener NO_OP = new HealthCheckListener() {};

    /** Every completed probe, passed or failed. */
    default void onProbe(ServiceEndpoint endpoint, HealthCheckResult result) {}

    /** The endpoint crossed a hysteresis threshold. */
    default void onHealthChanged(ServiceEndpoint endpoint, HealthCheckResult result) {}
}
