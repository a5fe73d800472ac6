package com.meshcontrol.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.meshcontrol.core.model.ServiceEndpoint;
import com.meshcontrol.core.model.ServiceInfo;
import com.meshcontrol.core.model.ServiceType;

import java.util.List;
import java.util.Map;

/**
 * Inbound JSON body for POST /api/v1/services.
 *
 * @param serviceId    unique service id
 * @param name         display name; nullable, defaults to the id
 * @param description  free-form description; nullable
 * @param type         service type (API, DATABASE, ...); nullable, defaults to API
 * @param version      deployed version; nullable
 * @param endpoints    at least one endpoint
 * @param dependencies ids of services this one calls; nullable
 */
public record RegisterServiceRequest(
    @JsonProperty("service_id") String serviceId,
    String name,
    String description,
    ServiceType type,
    String version,
    List<Endpoint> endpoints,
    List<String> dependencies
) {

    public record Endpoint(
        String host,
        int port,
        String protocol,
        String path,
        Integer weight,
        Map<String, String> metadata,
        @JsonProperty("health_check_path") String healthCheckPath
    ) {}

    public ServiceInfo toServiceInfo() {
        List<ServiceEndpoint> mapped = endpoints == null ? List.of() : endpoints.stream()
                .map(e -> new ServiceEndpoint(serviceId, e.host(), e.port(), e.protocol(), e.path(),
                        e.weight() == null ? 1 : e.weight(), e.metadata(), e.healthCheckPath()))
                .toList();
        return new ServiceInfo(serviceId, name, description, type, version, mapped, dependencies, null);
    }
}
