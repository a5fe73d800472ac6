package com.meshcontrol.core.metrics;

import com.meshcontrol.core.breaker.CircuitState;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class MeshMetricsTest {

    private SimpleMeterRegistry registry;
    private MeshMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MeshMetrics(registry);
    }

    @Test
    @DisplayName("recordRequest updates the timer and per-service aggregates")
    void recordRequest() {
        metrics.recordRequest("orders", true, 100);
        metrics.recordRequest("orders", false, 300);

        RequestStats stats = metrics.stats("orders");
        assertEquals(2, stats.total());
        assertEquals(1, stats.successful());
        assertEquals(1, stats.failed());
        assertEquals(200.0, stats.averageResponseTimeMs(), 0.001);
        assertEquals(0.5, stats.successRate(), 0.001);

        assertEquals(1, registry.get("mesh.requests.duration")
                .tag("service", "orders").tag("outcome", "success").timer().count());
    }

    @Test
    @DisplayName("totals span all services")
    void totals() {
        metrics.recordRequest("orders", true, 10);
        metrics.recordRequest("billing", true, 30);
        RequestStats totals = metrics.totals();
        assertEquals(2, totals.total());
        assertEquals(20.0, totals.averageResponseTimeMs(), 0.001);
        assertEquals(RequestStats.EMPTY, metrics.stats("unknown"));
    }

    @Test
    @DisplayName("Forgotten services leave the totals but keep their meters")
    void forgetDropsFromTotals() {
        metrics.recordRequest("orders", true, 10);
        metrics.recordRequest("billing", true, 30);

        metrics.forget("billing");

        RequestStats totals = metrics.totals();
        assertEquals(1, totals.total());
        assertEquals(10.0, totals.averageResponseTimeMs(), 0.001);
        assertEquals(1, registry.get("mesh.requests.duration")
                .tag("service", "billing").timer().count());
    }

    @Test
    @DisplayName("Rejections and breaker transitions are counted with tags")
    void countersTagged() {
        metrics.recordRejection("orders", "rate_limited");
        metrics.recordRejection("orders", "rate_limited");
        metrics.recordBreakerTransition("orders", CircuitState.CLOSED, CircuitState.OPEN);

        assertEquals(2.0, registry.get("mesh.requests.rejected")
                .tag("reason", "rate_limited").counter().count());
        assertEquals(1.0, registry.get("mesh.circuit_breaker.transitions")
                .tag("to", "OPEN").counter().count());
    }

    @Test
    @DisplayName("Gauges sample their supplier")
    void gauges() {
        AtomicInteger open = new AtomicInteger(3);
        metrics.gauge("mesh.circuit_breaker.open", "Open breakers", open::get);
        assertEquals(3.0, registry.get("mesh.circuit_breaker.open").gauge().value());
        open.set(1);
        assertEquals(1.0, registry.get("mesh.circuit_breaker.open").gauge().value());
    }

    @Test
    @DisplayName("flush returns per-service snapshots")
    void flush() {
        metrics.recordRequest("orders", true, 10);
        metrics.recordRequest("billing", false, 10);
        Map<String, RequestStats> snapshot = metrics.flush();
        assertEquals(2, snapshot.size());
        assertEquals(1, snapshot.get("billing").failed());

        metrics.forget("billing");
        assertEquals(RequestStats.EMPTY, metrics.stats("billing"));
    }

    @Test
    @DisplayName("A failing meter registry never reaches the caller")
    void failingSinkIsContained() {
        MeterRegistry broken = mock(MeterRegistry.class);
        MeshMetrics guarded = new MeshMetrics(broken);

        assertDoesNotThrow(() -> guarded.recordRequest("orders", true, 5));
        assertDoesNotThrow(() -> guarded.recordRejection("orders", "circuit_open"));
        assertDoesNotThrow(() -> guarded.gauge("g", "d", () -> 1));
        assertEquals(1, guarded.stats("orders").total());
    }
}
