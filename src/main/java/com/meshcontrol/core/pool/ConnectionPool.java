package com.meshcontrol.core.pool;

import com.meshcontrol.core.error.ConnectionPoolTimeoutException;
import com.meshcontrol.core.error.MeshException;
import com.meshcontrol.core.model.ServiceEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collection;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded per-endpoint pool of {@link MeshConnection}s.
 * <p>
 * Each endpoint has a semaphore with {@code maxConnectionsPerEndpoint} permits and a
 * stack of idle connections. {@link #acquire(ServiceEndpoint)} completes immediately when
 * a permit is free; otherwise it waits on a pool thread for at most
 * {@code acquireTimeout} and then fails with {@link ConnectionPoolTimeoutException}.
 * A lease always returns its permit to the endpoint pool that issued it, so a lease that
 * outlives {@link #closeEndpoint} never frees capacity in a pool created afterwards.
 */
public class ConnectionPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConnectionPool.class);

    private final ConnectionFactory factory;
    private final PoolConfig config;
    private final ConcurrentHashMap<String, EndpointPool> pools = new ConcurrentHashMap<>();
    private final ExecutorService waiters;
    private volatile boolean closed;

    public ConnectionPool(ConnectionFactory factory, PoolConfig config) {
        this.factory = factory;
        this.config = config;
        AtomicInteger counter = new AtomicInteger();
        this.waiters = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "mesh-pool-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public CompletableFuture<PooledConnection> acquire(ServiceEndpoint endpoint) {
        if (closed) {
            return CompletableFuture.failedFuture(new IllegalStateException("Connection pool is closed"));
        }
        EndpointPool pool = pools.computeIfAbsent(endpoint.endpointId(),
                id -> new EndpointPool(config.maxConnectionsPerEndpoint()));
        if (pool.permits.tryAcquire()) {
            try {
                return CompletableFuture.completedFuture(lease(endpoint, pool));
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        }
        long timeoutMs = config.acquireTimeout().toMillis();
        return CompletableFuture.supplyAsync(() -> {
            boolean acquired;
            try {
                acquired = pool.permits.tryAcquire(timeoutMs, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CompletionException(e);
            }
            if (!acquired) {
                log.debug("Pool for {} exhausted, gave up after {}ms", endpoint.endpointId(), timeoutMs);
                throw new ConnectionPoolTimeoutException(endpoint.endpointId(), timeoutMs);
            }
            return lease(endpoint, pool);
        }, waiters);
    }

    // Caller holds a permit; it is returned if no connection can be produced.
    private PooledConnection lease(ServiceEndpoint endpoint, EndpointPool pool) {
        try {
            MeshConnection connection;
            while ((connection = pool.idle.pollFirst()) != null) {
                if (factory.validate(connection)) {
                    break;
                }
                closeQuietly(connection);
            }
            if (connection == null) {
                connection = factory.open(endpoint);
                log.debug("Opened connection to {}", endpoint.endpointId());
            }
            pool.active.incrementAndGet();
            return new PooledConnection(this, pool, connection);
        } catch (IOException e) {
            pool.permits.release();
            throw new MeshException("Could not open connection to " + endpoint.endpointId(), e);
        } catch (RuntimeException e) {
            pool.permits.release();
            throw e;
        }
    }

    void release(PooledConnection lease) {
        MeshConnection connection = lease.connection();
        EndpointPool pool = lease.origin();
        boolean reusable = !closed && !pool.retired && !lease.isBroken() && factory.validate(connection);
        if (reusable) {
            pool.idle.offerFirst(connection);
        } else {
            closeQuietly(connection);
        }
        pool.active.decrementAndGet();
        pool.permits.release();
        // closeEndpoint may have run while the connection was being returned
        if (pool.retired) {
            drain(pool);
        }
    }

    /** Forgets {@code endpointId}; leases still out are closed when released. */
    public void closeEndpoint(String endpointId) {
        EndpointPool pool = pools.remove(endpointId);
        if (pool != null) {
            pool.retired = true;
            drain(pool);
        }
    }

    public void closeEndpoints(Collection<String> endpointIds) {
        endpointIds.forEach(this::closeEndpoint);
    }

    public int activeCount(String endpointId) {
        EndpointPool pool = pools.get(endpointId);
        return pool == null ? 0 : pool.active.get();
    }

    public int idleCount(String endpointId) {
        EndpointPool pool = pools.get(endpointId);
        return pool == null ? 0 : pool.idle.size();
    }

    public int totalActive() {
        return pools.values().stream().mapToInt(p -> p.active.get()).sum();
    }

    public int totalIdle() {
        return pools.values().stream().mapToInt(p -> p.idle.size()).sum();
    }

    public PoolConfig getConfig() {
        return config;
    }

    public boolean isClosed() {
        return closed;
    }

    /** Closes idle connections and stops waiting acquisitions. Idempotent. */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        pools.values().forEach(this::drain);
        waiters.shutdownNow();
        log.info("Connection pool closed");
    }

    private void drain(EndpointPool pool) {
        MeshConnection connection;
        while ((connection = pool.idle.pollFirst()) != null) {
            closeQuietly(connection);
        }
    }

    private static void closeQuietly(MeshConnection connection) {
        try {
            connection.close();
        } catch (RuntimeException e) {
            log.debug("Error closing connection to {}: {}", connection.endpoint().endpointId(), e.getMessage());
        }
    }

    static final class EndpointPool {
        final Semaphore permits;
        final ConcurrentLinkedDeque<MeshConnection> idle = new ConcurrentLinkedDeque<>();
        final AtomicInteger active = new AtomicInteger();
        volatile boolean retired;

        EndpointPool(int max) {
            this.permits = new Semaphore(max, true);
        }
    }
}
