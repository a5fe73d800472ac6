package com.meshcontrol.core.error;

/**
 * A failed health probe. Recorded against the endpoint, never propagated to callers.
 */
public class HealthCheckException extends MeshException {

    private final String endpointId;

    public HealthCheckException(String endpointId, String message) {
        super(message);
        this.endpointId = endpointId;
    }

    public HealthCheckException(String endpointId, String message, Throwable cause) {
        super(message, cause);
        this.endpointId = endpointId;
    }

    public String getEndpointId() {
        return endpointId;
    }
}
