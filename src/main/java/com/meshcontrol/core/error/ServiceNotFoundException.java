package com.meshcontrol.core.error;

/**
 * Thrown when a service id is not registered. A caller bug; never retried.
 */
public class ServiceNotFoundException extends MeshException {

    private final String serviceId;

    public ServiceNotFoundException(String serviceId) {
        super("Service not found: " + serviceId);
        this.serviceId = serviceId;
    }

    public String getServiceId() {
        return serviceId;
    }
}
