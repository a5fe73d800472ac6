package com.meshcontrol.core.pool;

import com.meshcontrol.core.model.ServiceEndpoint;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lease of a {@link MeshConnection} from the {@link ConnectionPool}. Closing the lease
 * returns the connection to the pool, or discards it if it was {@linkplain #invalidate()
 * invalidated}. Closing twice has no effect.
 */
public final class PooledConnection implements AutoCloseable {

    private final ConnectionPool pool;
    private final ConnectionPool.EndpointPool origin;
    private final MeshConnection connection;
    private final AtomicBoolean released = new AtomicBoolean();
    private volatile boolean broken;

    PooledConnection(ConnectionPool pool, ConnectionPool.EndpointPool origin, MeshConnection connection) {
        this.pool = pool;
        this.origin = origin;
        this.connection = connection;
    }

    public MeshConnection connection() {
        return connection;
    }

    public ServiceEndpoint endpoint() {
        return connection.endpoint();
    }

    /** Marks the connection unusable so it is closed instead of reused. */
    public void invalidate() {
        broken = true;
    }

    ConnectionPool.EndpointPool origin() {
        return origin;
    }

    boolean isBroken() {
        return broken;
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            pool.release(this);
        }
    }
}
