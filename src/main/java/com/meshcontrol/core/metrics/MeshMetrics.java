package com.meshcontrol.core.metrics;

import com.meshcontrol.core.breaker.CircuitState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Supplier;

/**
 * Centralised Micrometer metrics for the service mesh.
 * <p>
 * Keeps per-service request aggregates in memory for status views. Every call into the
 * meter registry is guarded: a failing sink is logged and never reaches the routing path.
 */
@Service
public class MeshMetrics {

    private static final Logger log = LoggerFactory.getLogger(MeshMetrics.class);

    private final MeterRegistry registry;
    private final ConcurrentHashMap<String, ServiceCounters> services = new ConcurrentHashMap<>();
    private final AtomicBoolean sinkFailureLogged = new AtomicBoolean();

    public MeshMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRequest(String serviceId, boolean success, long ms) {
        services.computeIfAbsent(serviceId, id -> new ServiceCounters()).record(success, ms);
        safely(() -> Timer.builder("mesh.requests.duration")
                .description("Latency of calls routed through the mesh")
                .tag("service", serviceId)
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .record(Duration.ofMillis(ms)));
    }

    /**
     * Records a call refused before reaching an endpoint.
     *
     * @param reason "rate_limited", "circuit_open", "unavailable", "not_found" or "pool_timeout"
     */
    public void recordRejection(String serviceId, String reason) {
        safely(() -> Counter.builder("mesh.requests.rejected")
                .description("Calls refused before reaching an endpoint")
                .tag("service", serviceId)
                .tag("reason", reason)
                .register(registry)
                .increment());
    }

    public void recordBreakerTransition(String serviceId, CircuitState from, CircuitState to) {
        safely(() -> Counter.builder("mesh.circuit_breaker.transitions")
                .tag("service", serviceId)
                .tag("from", from.name())
                .tag("to", to.name())
                .register(registry)
                .increment());
    }

    public void recordRateLimitDecision(String rule, boolean allowed) {
        safely(() -> Counter.builder("mesh.rate_limiter.decisions")
                .tag("rule", rule == null ? "none" : rule)
                .tag("result", allowed ? "allowed" : "rejected")
                .register(registry)
                .increment());
    }

    public void recordHealthCheck(String serviceId, boolean healthy, long ms) {
        safely(() -> {
            Counter.builder("mesh.health_checks")
                    .tag("service", serviceId)
                    .tag("result", healthy ? "pass" : "fail")
                    .register(registry)
                    .increment();
            Timer.builder("mesh.health_check.duration")
                    .tag("service", serviceId)
                    .register(registry)
                    .record(Duration.ofMillis(ms));
        });
    }

    public void recordHealthChange(String serviceId, boolean healthy) {
        safely(() -> Counter.builder("mesh.endpoint.health_changes")
                .tag("service", serviceId)
                .tag("to", healthy ? "healthy" : "unhealthy")
                .register(registry)
                .increment());
    }

    public void recordPoolWait(String serviceId, long ms) {
        safely(() -> DistributionSummary.builder("mesh.pool.acquire_wait")
                .description("Milliseconds spent waiting for a pooled connection")
                .baseUnit("milliseconds")
                .tag("service", serviceId)
                .register(registry)
                .record(ms));
    }

    /**
     * @param action "registered", "replaced" or "unregistered"
     */
    public void recordRegistration(String action) {
        safely(() -> Counter.builder("mesh.registry.changes")
                .tag("action", action)
                .register(registry)
                .increment());
    }

    /** Registers a gauge sampled from {@code value} on every scrape. */
    public void gauge(String name, String description, Supplier<Number> value) {
        safely(() -> Gauge.builder(name, value)
                .description(description)
                .register(registry));
    }

    public RequestStats stats(String serviceId) {
        ServiceCounters counters = services.get(serviceId);
        return counters == null ? RequestStats.EMPTY : counters.snapshot();
    }

    /**
     * Totals across the services currently tracked. Unregistering a service drops its
     * aggregates through {@link #forget(String)}, so they leave the totals too.
     */
    public RequestStats totals() {
        long total = 0;
        long successful = 0;
        long failed = 0;
        long responseMs = 0;
        for (ServiceCounters counters : services.values()) {
            total += counters.total.sum();
            successful += counters.successful.sum();
            failed += counters.failed.sum();
            responseMs += counters.responseMs.sum();
        }
        return new RequestStats(total, successful, failed, total == 0 ? 0.0 : (double) responseMs / total);
    }

    /** Drops the per-service aggregates; Micrometer meters keep their own counts. */
    public void forget(String serviceId) {
        services.remove(serviceId);
    }

    /**
     * Logs the current request aggregates and returns them per service. Run periodically
     * and on shutdown; meters themselves are published by the registry.
     */
    public Map<String, RequestStats> flush() {
        Map<String, RequestStats> snapshot = new TreeMap<>();
        services.forEach((id, counters) -> snapshot.put(id, counters.snapshot()));
        RequestStats totals = totals();
        log.info("Mesh request totals: {} total, {} ok, {} failed, avg {} ms across {} services",
                totals.total(), totals.successful(), totals.failed(),
                String.format("%.1f", totals.averageResponseTimeMs()), snapshot.size());
        snapshot.forEach((id, stats) -> log.debug("Service {}: {}", id, stats));
        return snapshot;
    }

    public MeterRegistry registry() {
        return registry;
    }

    private void safely(Runnable meterCall) {
        try {
            meterCall.run();
        } catch (RuntimeException e) {
            if (sinkFailureLogged.compareAndSet(false, true)) {
                log.warn("Metrics sink failed, further failures logged at debug: {}", e.getMessage(), e);
            } else {
                log.debug("Metrics sink failed: {}", e.getMessage());
            }
        }
    }

    private static final class ServiceCounters {
        final LongAdder total = new LongAdder();
        final LongAdder successful = new LongAdder();
        final LongAdder failed = new LongAdder();
        final LongAdder responseMs = new LongAdder();

        void record(boolean success, long ms) {
            total.increment();
            (success ? successful : failed).increment();
            responseMs.add(Math.max(0, ms));
        }

        RequestStats snapshot() {
            long n = total.sum();
            return new RequestStats(n, successful.sum(), failed.sum(),
                    n == 0 ? 0.0 : (double) responseMs.sum() / n);
        }
    }
}
