package com.meshcontrol.core.health;

import com.meshcontrol.core.MutableClock;
import com.meshcontrol.core.error.HealthCheckException;
import com.meshcontrol.core.model.ServiceEndpoint;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class HealthCheckerTest {

    private final ServiceEndpoint endpoint = ServiceEndpoint.of("orders", "10.0.0.1", 8080);

    private MutableClock clock;
    private AtomicBoolean up;
    private List<Boolean> changes;
    private HealthChecker checker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        up = new AtomicBoolean(true);
        changes = new CopyOnWriteArrayList<>();
        HealthCheckListener listener = new HealthCheckListener() {
            @Override
            public void onHealthChanged(ServiceEndpoint e, HealthCheckResult result) {
                changes.add(result.healthy());
            }
        };
        checker = new HealthChecker((e, timeout) -> up.get(),
                new HealthCheckConfig(Duration.ofSeconds(30), Duration.ofSeconds(1), 3, 2), clock, listener, 1);
    }

    @AfterEach
    void tearDown() {
        checker.shutdown();
    }

    @Nested
    @DisplayName("Hysteresis")
    class Hysteresis {

        @Test
        @DisplayName("New endpoints start healthy")
        void startsHealthy() {
            checker.track(endpoint);
            assertTrue(checker.isHealthy(endpoint.endpointId()));
            assertTrue(checker.isHealthy("http://unknown:1"), "Untracked endpoints count as healthy");
        }

        @Test
        @DisplayName("Goes unhealthy only after the unhealthy threshold")
        void unhealthyAfterThreshold() {
            up.set(false);
            checker.checkNow(endpoint);
            checker.checkNow(endpoint);
            assertTrue(checker.isHealthy(endpoint.endpointId()));

            HealthCheckResult result = checker.checkNow(endpoint);
            assertFalse(result.healthy());
            assertEquals(3, result.consecutiveFailures());
            assertEquals("Unhealthy response", result.lastError());
            assertEquals(List.of(false), changes);
        }

        @Test
        @DisplayName("Recovers only after the healthy threshold")
        void recoversAfterThreshold() {
            up.set(false);
            for (int i = 0; i < 3; i++) {
                checker.checkNow(endpoint);
            }
            up.set(true);
            checker.checkNow(endpoint);
            assertFalse(checker.isHealthy(endpoint.endpointId()));
            checker.checkNow(endpoint);
            assertTrue(checker.isHealthy(endpoint.endpointId()));
            assertEquals(List.of(false, true), changes);
        }

        @Test
        @DisplayName("A flapping endpoint never changes state")
        void flappingIgnored() {
            for (int i = 0; i < 10; i++) {
                up.set(i % 2 == 0);
                checker.checkNow(endpoint);
            }
            assertTrue(checker.isHealthy(endpoint.endpointId()));
            assertTrue(changes.isEmpty());
        }
    }

    @Test
    @DisplayName("Probe exceptions count as failures")
    void probeExceptionIsFailure() {
        HealthChecker throwing = new HealthChecker((e, timeout) -> {
            throw new HealthCheckException(e.endpointId(), "connection refused");
        }, new HealthCheckConfig(Duration.ofSeconds(30), Duration.ofSeconds(1), 1, 1), clock, null, 1);
        try {
            HealthCheckResult result = throwing.checkNow(endpoint);
            assertFalse(result.healthy());
            assertNotNull(result.lastError());
            assertEquals(clock.instant(), result.lastChecked());
        } finally {
            throwing.shutdown();
        }
    }

    @Test
    @DisplayName("Scheduled checks run periodically until stopped")
    void scheduledChecks() throws InterruptedException {
        AtomicInteger probes = new AtomicInteger();
        CountDownLatch latch = new CountDownLatch(3);
        HealthChecker fast = new HealthChecker((e, timeout) -> {
            probes.incrementAndGet();
            latch.countDown();
            return true;
        }, new HealthCheckConfig(Duration.ofMillis(10), Duration.ofSeconds(1), 1, 1), clock, null, 1);
        try {
            fast.start(endpoint);
            assertEquals(1, fast.scheduledCount());
            assertTrue(latch.await(5, TimeUnit.SECONDS));

            fast.stop(endpoint.endpointId());
            assertEquals(0, fast.scheduledCount());
            assertEquals(0, fast.trackedCount());
        } finally {
            fast.shutdown();
        }
        assertTrue(fast.isStopped());
        assertThrows(IllegalStateException.class, () -> fast.start(endpoint));
    }

    @Test
    @DisplayName("stop forgets the endpoint's health")
    void stopForgets() {
        up.set(false);
        for (int i = 0; i < 3; i++) {
            checker.checkNow(endpoint);
        }
        checker.stop(endpoint.endpointId());
        assertTrue(checker.isHealthy(endpoint.endpointId()));
        assertTrue(checker.result(endpoint.endpointId()).isEmpty());
    }
}
