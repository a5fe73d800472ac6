package com.meshcontrol.core.error;

/**
 * Thrown when a service is registered twice without asking for replacement.
 */
public class ServiceAlreadyRegisteredException extends MeshException {

    private final String serviceId;

    public ServiceAlreadyRegisteredException(String serviceId) {
        super("Service already registered: " + serviceId);
        this.serviceId = serviceId;
    }

    public String getServiceId() {
        return serviceId;
    }
}
