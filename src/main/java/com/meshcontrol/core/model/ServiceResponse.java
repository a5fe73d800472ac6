package com.meshcontrol.core.model;

import java.util.Map;

/**
 * Result of a call made through the mesh.
 *
 * @param requestId      correlation id of the originating request
 * @param serviceId      target service
 * @param endpointId     endpoint that served the call
 * @param statusCode     HTTP-style status code
 * @param headers        response headers
 * @param body           response body (nullable)
 * @param responseTimeMs wall-clock latency of the transport call
 * @param errorMessage   error detail for failed calls (nullable)
 */
public record ServiceResponse(
    String requestId,
    String serviceId,
    String endpointId,
    int statusCode,
    Map<String, String> headers,
    String body,
    long responseTimeMs,
    String errorMessage
) {

    public ServiceResponse {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    /** A call counts as a success for the circuit breaker when the status is below 400. */
    public boolean isSuccess() {
        return statusCode < 400;
    }

    public ServiceResponse withResponseTime(long ms) {
        return new ServiceResponse(requestId, serviceId, endpointId, statusCode, headers, body, ms, errorMessage);
    }
}
