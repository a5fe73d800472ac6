package com.meshcontrol.core.pool;

import com.meshcontrol.core.model.ServiceEndpoint;

import java.io.IOException;

/**
 * Opens and validates {@link MeshConnection}s for the {@link ConnectionPool}.
 */
public interface ConnectionFactory {

    MeshConnection open(ServiceEndpoint endpoint) throws IOException;

    /** Whether an idle connection may be handed out again. */
    default boolean validate(MeshConnection connection) {
        return connection.isOpen();
    }
}
