package com.meshcontrol.core.model;

import java.time.Duration;
import java.util.Map;

/**
 * A call routed through the mesh to one endpoint of a service.
 *
 * @param requestId correlation id, echoed in the response
 * @param serviceId target service
 * @param method    HTTP method
 * @param path      path appended to the endpoint's base path
 * @param headers   request headers
 * @param body      request body (nullable)
 * @param timeout   per-call timeout owned by the caller
 */
public record ServiceRequest(
    String requestId,
    String serviceId,
    String method,
    String path,
    Map<String, String> headers,
    String body,
    Duration timeout
) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    public ServiceRequest {
        method = (method == null || method.isBlank()) ? "GET" : method.toUpperCase();
        path = path == null ? "" : path;
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
    }

    public static ServiceRequest get(String requestId, String serviceId, String path) {
        return new ServiceRequest(requestId, serviceId, "GET", path, Map.of(), null, DEFAULT_TIMEOUT);
    }
}
