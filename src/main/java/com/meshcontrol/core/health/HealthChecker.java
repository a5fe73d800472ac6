package com.meshcontrol.core.health;

import com.meshcontrol.core.error.HealthCheckException;
import com.meshcontrol.core.logging.MdcContext;
import com.meshcontrol.core.model.ServiceEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Probes endpoints periodically and keeps their health with hysteresis.
 * <p>
 * Each tracked endpoint has its own fixed-delay task on a shared scheduler. A healthy
 * endpoint turns unhealthy after {@code unhealthyThreshold} failed probes in a row and
 * recovers after {@code healthyThreshold} passed probes in a row. New endpoints start
 * healthy. Probe failures are recorded on the endpoint and never propagate out of the
 * task.
 */
public class HealthChecker implements HealthView {

    private static final Logger log = LoggerFactory.getLogger(HealthChecker.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final HealthProbe probe;
    private final HealthCheckConfig config;
    private final Clock clock;
    private final HealthCheckListener listener;
    private final ScheduledExecutorService scheduler;

    private final ConcurrentHashMap<String, EndpointHealth> table = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ScheduledFuture<?>> tasks = new ConcurrentHashMap<>();
    private volatile boolean stopped;

    public HealthChecker(HealthProbe probe, HealthCheckConfig config, Clock clock,
                         HealthCheckListener listener, int threads) {
        this.probe = probe;
        this.config = config;
        this.clock = clock;
        this.listener = listener == null ? HealthCheckListener.NO_OP : listener;
        AtomicInteger counter = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "mesh-health-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /** Tracks {@code endpoint} as healthy without scheduling probes. */
    public void track(ServiceEndpoint endpoint) {
        table.putIfAbsent(endpoint.endpointId(), new EndpointHealth(endpoint));
    }

    /**
     * Tracks {@code endpoint} and schedules its probe every {@code interval}. A task
     * already running for the same endpoint is replaced.
     */
    public void start(ServiceEndpoint endpoint) {
        if (stopped) {
            throw new IllegalStateException("Health checker is stopped");
        }
        String endpointId = endpoint.endpointId();
        track(endpoint);
        long intervalMs = config.interval().toMillis();
        ScheduledFuture<?> task = scheduler.scheduleWithFixedDelay(
                () -> runCheck(endpoint), intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        ScheduledFuture<?> previous = tasks.put(endpointId, task);
        if (previous != null) {
            previous.cancel(false);
        }
        log.debug("Health checks scheduled for {} every {}ms", endpointId, intervalMs);
    }

    public void startAll(Collection<ServiceEndpoint> endpoints) {
        endpoints.forEach(this::start);
    }

    /** Cancels probing of {@code endpointId} and forgets its health. */
    public void stop(String endpointId) {
        ScheduledFuture<?> task = tasks.remove(endpointId);
        if (task != null) {
            task.cancel(false);
        }
        table.remove(endpointId);
    }

    public void stopAll(Collection<String> endpointIds) {
        endpointIds.forEach(this::stop);
    }

    /**
     * Probes {@code endpoint} on the calling thread and returns the updated view.
     * The endpoint is tracked first if it was not already.
     */
    public HealthCheckResult checkNow(ServiceEndpoint endpoint) {
        track(endpoint);
        return runCheck(endpoint);
    }

    /** Unknown endpoints count as healthy; there is no evidence against them. */
    @Override
    public boolean isHealthy(String endpointId) {
        EndpointHealth health = table.get(endpointId);
        return health == null || health.healthy;
    }

    public Optional<HealthCheckResult> result(String endpointId) {
        return Optional.ofNullable(table.get(endpointId)).map(EndpointHealth::snapshot);
    }

    public Map<String, HealthCheckResult> results() {
        return table.values().stream()
                .map(EndpointHealth::snapshot)
                .collect(Collectors.toMap(HealthCheckResult::endpointId, Function.identity()));
    }

    public int trackedCount() {
        return table.size();
    }

    public int scheduledCount() {
        return tasks.size();
    }

    public HealthCheckConfig getConfig() {
        return config;
    }

    /**
     * Cancels every task and waits for running probes to finish. No health state is
     * written once this returns.
     */
    public void shutdown() {
        if (stopped) {
            return;
        }
        stopped = true;
        tasks.values().forEach(task -> task.cancel(false));
        tasks.clear();
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
                scheduler.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Health checker stopped");
    }

    public boolean isStopped() {
        return stopped;
    }

    private HealthCheckResult runCheck(ServiceEndpoint endpoint) {
        String endpointId = endpoint.endpointId();
        EndpointHealth health = table.get(endpointId);
        if (health == null) {
            return HealthCheckResult.initial(endpointId);
        }
        if (stopped) {
            return health.snapshot();
        }
        try {
            MdcContext.setEndpoint(endpoint.serviceId(), endpointId);
            long start = System.nanoTime();
            boolean ok;
            String error = null;
            try {
                ok = probe.probe(endpoint, config.probeTimeout());
                if (!ok) {
                    error = "Unhealthy response";
                }
            } catch (HealthCheckException e) {
                ok = false;
                error = e.getMessage();
            } catch (RuntimeException e) {
                ok = false;
                error = e.getClass().getSimpleName() + ": " + e.getMessage();
            }
            long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            if (stopped) {
                return health.snapshot();
            }
            boolean changed = health.record(ok, latencyMs, error, clock.instant(),
                    config.unhealthyThreshold(), config.healthyThreshold());
            HealthCheckResult result = health.snapshot();
            if (!ok) {
                log.debug("Health probe failed for {} ({} in a row): {}",
                        endpointId, result.consecutiveFailures(), error);
            }
            // an endpoint stopped during the probe is no longer reported
            if (table.get(endpointId) == health) {
                listener.onProbe(endpoint, result);
                if (changed) {
                    log.info("Endpoint {} of service {} is now {}", endpointId, endpoint.serviceId(),
                            result.healthy() ? "healthy" : "unhealthy");
                    listener.onHealthChanged(endpoint, result);
                }
            }
            return result;
        } catch (RuntimeException e) {
            log.warn("Health check task for {} failed: {}", endpointId, e.getMessage(), e);
            return health.snapshot();
        } finally {
            MdcContext.clear();
        }
    }

    private static final class EndpointHealth {

        private final String endpointId;
        private volatile boolean healthy = true;
        private long latencyMs;
        private Instant lastChecked;
        private int consecutiveFailures;
        private int consecutiveSuccesses;
        private String lastError;

        EndpointHealth(ServiceEndpoint endpoint) {
            this.endpointId = endpoint.endpointId();
        }

        /** Returns whether the health flag flipped. */
        synchronized boolean record(boolean ok, long latency, String error, Instant now,
                                    int unhealthyThreshold, int healthyThreshold) {
            latencyMs = latency;
            lastChecked = now;
            boolean before = healthy;
            if (ok) {
                consecutiveSuccesses++;
                consecutiveFailures = 0;
                lastError = null;
                if (!healthy && consecutiveSuccesses >= healthyThreshold) {
                    healthy = true;
                }
            } else {
                consecutiveFailures++;
                consecutiveSuccesses = 0;
                lastError = error;
                if (healthy && consecutiveFailures >= unhealthyThreshold) {
                    healthy = false;
                }
            }
            return before != healthy;
        }

        synchronized HealthCheckResult snapshot() {
            return new HealthCheckResult(endpointId, healthy, latencyMs, lastChecked,
                    consecutiveFailures, consecutiveSuccesses, lastError);
        }
    }
}
