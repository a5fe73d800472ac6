package com.meshcontrol.core.pool;

import com.meshcontrol.core.model.ServiceEndpoint;

import java.io.IOException;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory connections; endpoints listed in {@link #refuse} fail to connect.
 */
public class FakeConnectionFactory implements ConnectionFactory {

    public final List<FakeConnection> opened = new CopyOnWriteArrayList<>();
    public final Set<String> refuse = ConcurrentHashMap.newKeySet();

    @Override
    public MeshConnection open(ServiceEndpoint endpoint) throws IOException {
        if (refuse.contains(endpoint.endpointId())) {
            throw new IOException("Connection refused: " + endpoint.endpointId());
        }
        FakeConnection connection = new FakeConnection(endpoint);
        opened.add(connection);
        return connection;
    }

    public static class FakeConnection implements MeshConnection {

        private final ServiceEndpoint endpoint;
        private volatile boolean open = true;

        FakeConnection(ServiceEndpoint endpoint) {
            this.endpoint = endpoint;
        }

        @Override
        public ServiceEndpoint endpoint() {
            return endpoint;
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public void close() {
            open = false;
        }
    }
}
