package com.meshcontrol.core.error;

/**
 * Thrown when no pooled connection became available within the acquire timeout.
 * Affects only the caller that was waiting.
 */
public class ConnectionPoolTimeoutException extends MeshException {

    private final String endpointId;

    public ConnectionPoolTimeoutException(String endpointId, long timeoutMs) {
        super("Timed out after " + timeoutMs + "ms waiting for a connection to " + endpointId);
        this.endpointId = endpointId;
    }

    public String getEndpointId() {
        return endpointId;
    }
}
