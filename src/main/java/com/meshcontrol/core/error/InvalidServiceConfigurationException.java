package com.meshcontrol.core.error;

/**
 * Thrown for bad thresholds, weights or endpoint definitions. Raised before any
 * state is changed, so a rejected configuration is never partially applied.
 */
public class InvalidServiceConfigurationException extends MeshException {
    public InvalidServiceConfigurationException(String message) {
        super(message);
    }
}
