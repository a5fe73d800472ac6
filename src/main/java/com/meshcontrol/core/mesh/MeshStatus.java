package com.meshcontrol.core.mesh;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.meshcontrol.core.balancer.StrategyType;

import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time summary of the whole mesh.
 */
public record MeshStatus(
    MeshLifecycle lifecycle,
    @JsonProperty("services_count") int servicesCount,
    @JsonProperty("total_endpoints") int totalEndpoints,
    @JsonProperty("healthy_endpoints") int healthyEndpoints,
    @JsonProperty("open_circuits") int openCircuits,
    StrategyType strategy,
    @JsonProperty("total_requests") long totalRequests,
    @JsonProperty("successful_requests") long successfulRequests,
    @JsonProperty("failed_requests") long failedRequests,
    @JsonProperty("average_response_time_ms") double averageResponseTimeMs,
    @JsonProperty("rate_limit_rejections") long rateLimitRejections,
    @JsonProperty("active_connections") int activeConnections,
    Map<String, Boolean> features,
    Instant timestamp
) {}
