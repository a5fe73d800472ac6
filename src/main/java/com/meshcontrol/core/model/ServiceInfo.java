package com.meshcontrol.core.model;

import java.time.Instant;
import java.util.List;

/**
 * A registered service and its endpoints.
 *
 * @param serviceId    unique service identifier
 * @param name         display name, defaults to the service id
 * @param description  free-form description (nullable)
 * @param type         service classification, defaults to {@link ServiceType#API}
 * @param version      deployed version, defaults to {@code 1.0.0}
 * @param endpoints    one or more endpoints, all owned by this service
 * @param dependencies ids of services this one calls
 * @param registeredAt set by the registry on (re)registration
 */
public record ServiceInfo(
    String serviceId,
    String name,
    String description,
    ServiceType type,
    String version,
    List<ServiceEndpoint> endpoints,
    List<String> dependencies,
    Instant registeredAt
) {

    public ServiceInfo {
        name = (name == null || name.isBlank()) ? serviceId : name;
        type = type == null ? ServiceType.API : type;
        version = (version == null || version.isBlank()) ? "1.0.0" : version;
        endpoints = endpoints == null ? List.of() : List.copyOf(endpoints);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    public static ServiceInfo of(String serviceId, List<ServiceEndpoint> endpoints) {
        return new ServiceInfo(serviceId, serviceId, null, ServiceType.API, "1.0.0",
                endpoints, List.of(), null);
    }

    public ServiceInfo withRegisteredAt(Instant when) {
        return new ServiceInfo(serviceId, name, description, type, version, endpoints, dependencies, when);
    }
}
