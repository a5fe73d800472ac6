package com.meshcontrol.core.error;

/**
 * Base type of every error raised by the mesh control layer.
 */
public class MeshException extends RuntimeException {
    public MeshException(String message) {
        super(message);
    }

    public MeshException(String message, Throwable cause) {
        super(message, cause);
    }
}
