package com.meshcontrol.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/rate-limit/check.
 *
 * @param clientKey   caller identity
 * @param resourceKey resource being accessed, usually a service id
 * @param cost        units to consume; nullable, defaults to 1
 */
public record RateLimitCheckRequest(
    @JsonProperty("client_key") String clientKey,
    @JsonProperty("resource_key") String resourceKey,
    Integer cost
) {}
