package com.meshcontrol.core.mesh;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.meshcontrol.core.breaker.CircuitState;

import java.time.Instant;

/**
 * Status of one endpoint as shown in a service status view.
 */
public record EndpointStatus(
    @JsonProperty("endpoint_id") String endpointId,
    String url,
    int weight,
    boolean healthy,
    @JsonProperty("circuit_state") CircuitState circuitState,
    @JsonProperty("consecutive_failures") int consecutiveFailures,
    @JsonProperty("in_flight") int inFlight,
    @JsonProperty("active_connections") int activeConnections,
    @JsonProperty("last_probe_latency_ms") long lastProbeLatencyMs,
    @JsonProperty("last_checked") Instant lastChecked,
    @JsonProperty("last_error") String lastError
) {}
