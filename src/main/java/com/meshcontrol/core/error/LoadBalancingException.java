package com.meshcontrol.core.error;

/**
 * Thrown when a load-balancing strategy produces an inconsistent result.
 * Fatal to the current selection attempt only.
 */
public class LoadBalancingException extends MeshException {
    public LoadBalancingException(String message) {
        super(message);
    }
}
