package com.meshcontrol.core.error;

/**
 * Thrown when a service has no eligible endpoint. Surfaced immediately and never
 * retried internally, so load shedding stays effective.
 */
public class ServiceUnavailableException extends MeshException {

    private final String serviceId;

    public ServiceUnavailableException(String serviceId, String message) {
        super(message);
        this.serviceId = serviceId;
    }

    public ServiceUnavailableException(String serviceId) {
        this(serviceId, "No healthy endpoint available for service: " + serviceId);
    }

    public String getServiceId() {
        return serviceId;
    }
}
