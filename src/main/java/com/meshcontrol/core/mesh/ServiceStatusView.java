package com.meshcontrol.core.mesh;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.meshcontrol.core.breaker.CircuitState;
import com.meshcontrol.core.metrics.RequestStats;
import com.meshcontrol.core.model.ServiceHealth;
import com.meshcontrol.core.model.ServiceType;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time status of one registered service.
 */
public record ServiceStatusView(
    @JsonProperty("service_id") String serviceId,
    String name,
    String description,
    ServiceType type,
    String version,
    ServiceHealth health,
    @JsonProperty("registered_at") Instant registeredAt,
    @JsonProperty("healthy_endpoints") int healthyEndpoints,
    @JsonProperty("total_endpoints") int totalEndpoints,
    List<EndpointStatus> endpoints,
    @JsonProperty("breaker_states") Map<String, CircuitState> breakerStates,
    List<String> dependencies,
    RequestStats requests
) {}
