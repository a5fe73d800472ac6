package com.meshcontrol.core.pool;

import com.meshcontrol.core.model.ServiceRequest;
import com.meshcontrol.core.model.ServiceResponse;

import java.io.IOException;

/**
 * Performs a call over a pooled connection. Blocking; the mesh runs it off the caller's
 * thread.
 */
@FunctionalInterface
public interface MeshTransport {

    /**
     * @throws IOException if the call could not be completed; the connection is then discarded
     */
    ServiceResponse execute(MeshConnection connection, ServiceRequest request) throws IOException;
}
