package com.meshcontrol.core.model;

import java.util.Map;

/**
 * One network-reachable instance of a registered service.
 * <p>
 * Immutable: an update replaces the endpoint wholesale. The endpoint id is its URL,
 * which is unique across the whole mesh.
 *
 * @param serviceId       owning service
 * @param host            host name or address
 * @param port            TCP port
 * @param protocol        URL scheme, defaults to {@code http}
 * @param path            base path, empty or starting with {@code /}
 * @param weight          relative weight for weighted strategies; 0 excludes the endpoint from them
 * @param metadata        free-form labels (zone, version, ...)
 * @param healthCheckPath path probed by the health checker, defaults to {@code /health}
 */
public record ServiceEndpoint(
    String serviceId,
    String host,
    int port,
    String protocol,
    String path,
    int weight,
    Map<String, String> metadata,
    String healthCheckPath
) {

    public static final String DEFAULT_PROTOCOL = "http";
    public static final String DEFAULT_HEALTH_CHECK_PATH = "/health";

    public ServiceEndpoint {
        protocol = (protocol == null || protocol.isBlank()) ? DEFAULT_PROTOCOL : protocol.trim().toLowerCase();
        path = normalizePath(path);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        healthCheckPath = (healthCheckPath == null || healthCheckPath.isBlank())
                ? DEFAULT_HEALTH_CHECK_PATH : normalizePath(healthCheckPath);
    }

    public static ServiceEndpoint of(String serviceId, String host, int port) {
        return new ServiceEndpoint(serviceId, host, port, DEFAULT_PROTOCOL, "", 1, Map.of(), null);
    }

    public static ServiceEndpoint of(String serviceId, String host, int port, int weight) {
        return new ServiceEndpoint(serviceId, host, port, DEFAULT_PROTOCOL, "", weight, Map.of(), null);
    }

    /** The endpoint's URL, {@code protocol://host:port/path}. */
    public String url() {
        return protocol + "://" + host + ":" + port + path;
    }

    /** Mesh-wide identifier of this endpoint; breaker, health and pool state are keyed by it. */
    public String endpointId() {
        return url();
    }

    public String healthCheckUrl() {
        return protocol + "://" + host + ":" + port + healthCheckPath;
    }

    public ServiceEndpoint withWeight(int newWeight) {
        return new ServiceEndpoint(serviceId, host, port, protocol, path, newWeight, metadata, healthCheckPath);
    }

    private static String normalizePath(String p) {
        if (p == null || p.isBlank()) return "";
        String trimmed = p.trim();
        return trimmed.startsWith("/") ? trimmed : "/" + trimmed;
    }
}
