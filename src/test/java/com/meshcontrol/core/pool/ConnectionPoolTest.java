package com.meshcontrol.core.pool;

import com.meshcontrol.core.error.ConnectionPoolTimeoutException;
import com.meshcontrol.core.error.MeshException;
import com.meshcontrol.core.model.ServiceEndpoint;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionPoolTest {

    private final ServiceEndpoint endpoint = ServiceEndpoint.of("orders", "10.0.0.1", 8080);

    private FakeConnectionFactory factory;
    private ConnectionPool pool;

    @BeforeEach
    void setUp() {
        factory = new FakeConnectionFactory();
        pool = new ConnectionPool(factory, new PoolConfig(2, Duration.ofMillis(100)));
    }

    @AfterEach
    void tearDown() {
        pool.close();
    }

    private PooledConnection acquire() throws Exception {
        return pool.acquire(endpoint).get(5, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("Released connections are reused")
    void reusesConnections() throws Exception {
        PooledConnection first = acquire();
        MeshConnection raw = first.connection();
        assertEquals(1, pool.activeCount(endpoint.endpointId()));
        first.close();

        assertEquals(0, pool.activeCount(endpoint.endpointId()));
        assertEquals(1, pool.idleCount(endpoint.endpointId()));

        try (PooledConnection second = acquire()) {
            assertSame(raw, second.connection());
        }
        assertEquals(1, factory.opened.size());
    }

    @Test
    @DisplayName("Closing a lease twice releases it once")
    void doubleCloseIsIdempotent() throws Exception {
        PooledConnection lease = acquire();
        lease.close();
        lease.close();
        assertEquals(0, pool.activeCount(endpoint.endpointId()));
        assertEquals(1, pool.idleCount(endpoint.endpointId()));
    }

    @Test
    @DisplayName("Exhausted pool times out after the acquire timeout")
    void exhaustionTimesOut() throws Exception {
        PooledConnection a = acquire();
        PooledConnection b = acquire();

        CompletableFuture<PooledConnection> waiting = pool.acquire(endpoint);
        ExecutionException e = assertThrows(ExecutionException.class, () -> waiting.get(5, TimeUnit.SECONDS));
        assertInstanceOf(ConnectionPoolTimeoutException.class, e.getCause());

        a.close();
        b.close();
    }

    @Test
    @DisplayName("A waiter is served when a lease is returned")
    void waiterServedOnRelease() throws Exception {
        pool = new ConnectionPool(factory, new PoolConfig(1, Duration.ofSeconds(5)));
        PooledConnection held = acquire();

        CompletableFuture<PooledConnection> waiting = pool.acquire(endpoint);
        assertFalse(waiting.isDone());
        held.close();

        try (PooledConnection next = waiting.get(5, TimeUnit.SECONDS)) {
            assertSame(held.connection(), next.connection());
        }
    }

    @Test
    @DisplayName("Invalidated connections are closed, not pooled")
    void invalidatedNotPooled() throws Exception {
        PooledConnection lease = acquire();
        lease.invalidate();
        lease.close();

        assertFalse(lease.connection().isOpen());
        assertEquals(0, pool.idleCount(endpoint.endpointId()));
    }

    @Test
    @DisplayName("Connect failures return the permit")
    void connectFailureReturnsPermit() {
        factory.refuse.add(endpoint.endpointId());
        for (int i = 0; i < 3; i++) {
            ExecutionException e = assertThrows(ExecutionException.class, this::acquire);
            assertInstanceOf(MeshException.class, e.getCause());
        }
        factory.refuse.clear();
        assertDoesNotThrow(() -> acquire().close());
    }

    @Test
    @DisplayName("Endpoints are pooled independently")
    void independentEndpoints() throws Exception {
        ServiceEndpoint other = ServiceEndpoint.of("orders", "10.0.0.2", 8080);
        PooledConnection a = acquire();
        PooledConnection b = acquire();
        try (PooledConnection c = pool.acquire(other).get(1, TimeUnit.SECONDS)) {
            assertEquals(3, pool.totalActive());
        }
        a.close();
        b.close();
    }

    @Test
    @DisplayName("Closed pool rejects acquisition and closes returned leases")
    void closedPool() throws Exception {
        PooledConnection lease = acquire();
        pool.close();
        assertTrue(pool.isClosed());

        lease.close();
        assertFalse(lease.connection().isOpen());
        assertTrue(pool.acquire(endpoint).isCompletedExceptionally());
    }

    @Test
    @DisplayName("A lease that outlives closeEndpoint never frees capacity in the new pool")
    void staleLeaseDoesNotWidenNewPool() throws Exception {
        ConnectionPool single = new ConnectionPool(factory, new PoolConfig(1, Duration.ofMillis(100)));
        try {
            PooledConnection stale = single.acquire(endpoint).get(5, TimeUnit.SECONDS);
            single.closeEndpoint(endpoint.endpointId());
            PooledConnection fresh = single.acquire(endpoint).get(5, TimeUnit.SECONDS);

            stale.close();

            assertFalse(stale.connection().isOpen(), "Connection of a closed endpoint is discarded");
            assertEquals(1, single.activeCount(endpoint.endpointId()));
            assertEquals(0, single.idleCount(endpoint.endpointId()));
            ExecutionException e = assertThrows(ExecutionException.class,
                    () -> single.acquire(endpoint).get(5, TimeUnit.SECONDS));
            assertInstanceOf(ConnectionPoolTimeoutException.class, e.getCause());

            fresh.close();
            assertEquals(0, single.activeCount(endpoint.endpointId()));
        } finally {
            single.close();
        }
    }
}
