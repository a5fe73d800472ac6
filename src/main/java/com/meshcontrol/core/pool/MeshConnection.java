package com.meshcontrol.core.pool;

import com.meshcontrol.core.model.ServiceEndpoint;

/**
 * A reusable transport connection to one endpoint.
 */
public interface MeshConnection extends AutoCloseable {

    ServiceEndpoint endpoint();

    boolean isOpen();

    /** Releases the underlying transport resources. Must not throw. */
    @Override
    void close();
}
