package com.meshcontrol.core.registry;

import com.meshcontrol.core.cache.TtlCache;
import com.meshcontrol.core.error.InvalidServiceConfigurationException;
import com.meshcontrol.core.error.ServiceAlreadyRegisteredException;
import com.meshcontrol.core.error.ServiceNotFoundException;
import com.meshcontrol.core.model.ServiceEndpoint;
import com.meshcontrol.core.model.ServiceInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Authoritative map of registered services and their endpoints.
 * <p>
 * Reads are lock-free. Register and unregister are serialized so that the service map
 * and the endpoint ownership index always agree. Endpoint lookups are served from a
 * {@link TtlCache} that is invalidated on every change.
 */
public class ServiceRegistry {

    private static final Logger log = LoggerFactory.getLogger(ServiceRegistry.class);

    private final ConcurrentHashMap<String, ServiceInfo> services = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> endpointOwners = new ConcurrentHashMap<>();
    private final TtlCache<String, List<ServiceEndpoint>> lookups;
    private final Clock clock;
    private final Duration lookupTtl;
    private final Object writeLock = new Object();

    public ServiceRegistry(Clock clock, Duration lookupTtl) {
        if (lookupTtl == null || lookupTtl.isNegative() || lookupTtl.isZero()) {
            throw new InvalidServiceConfigurationException("discovery interval must be positive");
        }
        this.clock = clock;
        this.lookupTtl = lookupTtl;
        this.lookups = new TtlCache<>(clock);
    }

    /**
     * Registers {@code info}, stamping its registration time.
     *
     * @param replace whether an existing registration with the same id may be overwritten
     * @return the previous registration when one was replaced
     * @throws InvalidServiceConfigurationException if the service fails validation
     * @throws ServiceAlreadyRegisteredException    if the id is taken and {@code replace} is false
     */
    public Optional<ServiceInfo> register(ServiceInfo info, boolean replace) {
        ServiceInfo normalized = validate(info);
        synchronized (writeLock) {
            ServiceInfo previous = services.get(normalized.serviceId());
            if (previous != null && !replace) {
                throw new ServiceAlreadyRegisteredException(normalized.serviceId());
            }
            for (ServiceEndpoint endpoint : normalized.endpoints()) {
                String owner = endpointOwners.get(endpoint.endpointId());
                if (owner != null && !owner.equals(normalized.serviceId())) {
                    throw new InvalidServiceConfigurationException("Endpoint " + endpoint.endpointId()
                            + " is already owned by service " + owner);
                }
            }
            if (previous != null) {
                previous.endpoints().forEach(e -> endpointOwners.remove(e.endpointId()));
            }
            ServiceInfo stored = normalized.withRegisteredAt(clock.instant());
            services.put(stored.serviceId(), stored);
            stored.endpoints().forEach(e -> endpointOwners.put(e.endpointId(), stored.serviceId()));
            lookups.invalidate(stored.serviceId());
            log.debug("Registry now holds {} services after registering {}", services.size(), stored.serviceId());
            return Optional.ofNullable(previous);
        }
    }

    public Optional<ServiceInfo> unregister(String serviceId) {
        synchronized (writeLock) {
            ServiceInfo removed = services.remove(serviceId);
            if (removed == null) {
                return Optional.empty();
            }
            removed.endpoints().forEach(e -> endpointOwners.remove(e.endpointId(), serviceId));
            lookups.invalidate(serviceId);
            return Optional.of(removed);
        }
    }

    public Optional<ServiceInfo> get(String serviceId) {
        return serviceId == null ? Optional.empty() : Optional.ofNullable(services.get(serviceId));
    }

    public ServiceInfo require(String serviceId) {
        return get(serviceId).orElseThrow(() -> new ServiceNotFoundException(serviceId));
    }

    public boolean contains(String serviceId) {
        return serviceId != null && services.containsKey(serviceId);
    }

    /**
     * Endpoints of a service in registration order, served from the discovery cache.
     *
     * @throws ServiceNotFoundException if the service is not registered
     */
    public List<ServiceEndpoint> endpoints(String serviceId) {
        Optional<List<ServiceEndpoint>> cached = lookups.get(serviceId);
        if (cached.isPresent()) {
            return cached.get();
        }
        ServiceInfo info = require(serviceId);
        List<ServiceEndpoint> endpoints = info.endpoints();
        // a concurrent unregister may have invalidated the entry between require and set
        synchronized (writeLock) {
            if (services.get(serviceId) == info) {
                lookups.set(serviceId, endpoints, lookupTtl);
            }
        }
        return endpoints;
    }

    /** Id of the service owning {@code endpointId}, if any. */
    public Optional<String> ownerOf(String endpointId) {
        return Optional.ofNullable(endpointOwners.get(endpointId));
    }

    public List<ServiceInfo> all() {
        List<ServiceInfo> list = new ArrayList<>(services.values());
        list.sort(Comparator.comparing(ServiceInfo::serviceId));
        return list;
    }

    public int size() {
        return services.size();
    }

    public int endpointCount() {
        return endpointOwners.size();
    }

    /** Drops expired discovery cache entries. */
    public int sweep() {
        return lookups.sweep();
    }

    private static ServiceInfo validate(ServiceInfo info) {
        if (info == null) {
            throw new InvalidServiceConfigurationException("service info is required");
        }
        String serviceId = info.serviceId();
        if (serviceId == null || serviceId.isBlank()) {
            throw new InvalidServiceConfigurationException("serviceId must not be blank");
        }
        if (info.endpoints().isEmpty()) {
            throw new InvalidServiceConfigurationException("Service " + serviceId + " has no endpoints");
        }
        if (info.dependencies().contains(serviceId)) {
            throw new InvalidServiceConfigurationException("Service " + serviceId + " depends on itself");
        }

        List<ServiceEndpoint> endpoints = new ArrayList<>(info.endpoints().size());
        Set<String> seen = new HashSet<>();
        for (ServiceEndpoint endpoint : info.endpoints()) {
            if (endpoint == null) {
                throw new InvalidServiceConfigurationException("Service " + serviceId + " has a null endpoint");
            }
            if (endpoint.serviceId() != null && !endpoint.serviceId().equals(serviceId)) {
                throw new InvalidServiceConfigurationException("Endpoint " + endpoint.endpointId()
                        + " belongs to " + endpoint.serviceId() + ", not " + serviceId);
            }
            if (endpoint.host() == null || endpoint.host().isBlank()) {
                throw new InvalidServiceConfigurationException("Endpoint host must not be blank for " + serviceId);
            }
            if (endpoint.port() < 1 || endpoint.port() > 65535) {
                throw new InvalidServiceConfigurationException("Port out of range for " + serviceId
                        + ": " + endpoint.port());
            }
            if (endpoint.weight() < 0) {
                throw new InvalidServiceConfigurationException("Negative weight for " + endpoint.endpointId());
            }
            ServiceEndpoint owned = endpoint.serviceId() == null
                    ? new ServiceEndpoint(serviceId, endpoint.host(), endpoint.port(), endpoint.protocol(),
                            endpoint.path(), endpoint.weight(), endpoint.metadata(), endpoint.healthCheckPath())
                    : endpoint;
            if (!seen.add(owned.endpointId())) {
                throw new InvalidServiceConfigurationException("Duplicate endpoint " + owned.endpointId()
                        + " in service " + serviceId);
            }
            endpoints.add(owned);
        }
        return new ServiceInfo(serviceId, info.name(), info.description(), info.type(), info.version(),
                endpoints, info.dependencies(), info.registeredAt());
    }
}
