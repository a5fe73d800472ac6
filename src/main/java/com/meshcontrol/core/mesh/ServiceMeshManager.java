package com.meshcontrol.core.mesh;

import com.meshcontrol.core.balancer.LoadBalancer;
import com.meshcontrol.core.balancer.StrategyType;
import com.meshcontrol.core.breaker.CircuitBreakerRegistry;
import com.meshcontrol.core.breaker.CircuitBreakerState;
import com.meshcontrol.core.breaker.CircuitState;
import com.meshcontrol.core.config.MeshSettings;
import com.meshcontrol.core.error.CircuitBreakerOpenException;
import com.meshcontrol.core.error.ConnectionPoolTimeoutException;
import com.meshcontrol.core.error.InvalidServiceConfigurationException;
import com.meshcontrol.core.error.MeshException;
import com.meshcontrol.core.error.RateLimitExceededException;
import com.meshcontrol.core.error.ServiceNotFoundException;
import com.meshcontrol.core.error.ServiceUnavailableException;
import com.meshcontrol.core.events.EventBus;
import com.meshcontrol.core.events.MeshEvent;
import com.meshcontrol.core.health.HealthCheckListener;
import com.meshcontrol.core.health.HealthCheckResult;
import com.meshcontrol.core.health.HealthChecker;
import com.meshcontrol.core.health.HealthProbe;
import com.meshcontrol.core.logging.MdcContext;
import com.meshcontrol.core.metrics.MeshMetrics;
import com.meshcontrol.core.metrics.RequestStats;
import com.meshcontrol.core.model.ServiceEndpoint;
import com.meshcontrol.core.model.ServiceHealth;
import com.meshcontrol.core.model.ServiceInfo;
import com.meshcontrol.core.model.ServiceRequest;
import com.meshcontrol.core.model.ServiceResponse;
import com.meshcontrol.core.pool.ConnectionFactory;
import com.meshcontrol.core.pool.ConnectionPool;
import com.meshcontrol.core.pool.MeshTransport;
import com.meshcontrol.core.pool.PooledConnection;
import com.meshcontrol.core.ratelimit.RateLimitDecision;
import com.meshcontrol.core.ratelimit.RateLimitRule;
import com.meshcontrol.core.ratelimit.RateLimiter;
import com.meshcontrol.core.registry.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Entry point of the mesh: owns the registry, circuit breakers, rate limiter, load
 * balancer, health checker, connection pool and metrics of one mesh instance.
 * <p>
 * Lifecycle is {@code CREATED -> RUNNING -> STOPPED}. {@link #initialize()} starts the
 * background sweep and flush tasks and registers the configured services;
 * {@link #stop()} cancels every task, waits for it, closes the pool and flushes metrics.
 * Routing decisions never block; only health probes, pool waits and transport calls do,
 * and those run on the mesh's own threads.
 */
public class ServiceMeshManager {

    private static final Logger log = LoggerFactory.getLogger(ServiceMeshManager.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;
    private static final int REGISTRATION_LOCK_STRIPES = 32;

    private final MeshSettings settings;
    private final Clock clock;
    private final MeshMetrics metrics;
    private final EventBus eventBus;
    private final MeshTransport transport;

    private final ServiceRegistry registry;
    private final CircuitBreakerRegistry breakers;
    private final RateLimiter rateLimiter;
    private final HealthChecker healthChecker;
    private final LoadBalancer loadBalancer;
    private final ConnectionPool connectionPool;

    private final ScheduledExecutorService maintenance;
    private final ExecutorService callExecutor;
    private final AtomicReference<MeshLifecycle> lifecycle = new AtomicReference<>(MeshLifecycle.CREATED);

    // register and unregister of one service run one at a time, start to finish
    private final Object[] registrationLocks = new Object[REGISTRATION_LOCK_STRIPES];

    public ServiceMeshManager(MeshSettings settings, HealthProbe probe, ConnectionFactory connectionFactory,
                              MeshTransport transport, MeshMetrics metrics, EventBus eventBus, Clock clock) {
        this.settings = settings;
        this.clock = clock;
        for (int i = 0; i < registrationLocks.length; i++) {
            registrationLocks[i] = new Object();
        }
        this.metrics = metrics;
        this.eventBus = eventBus;
        this.transport = transport;

        this.registry = new ServiceRegistry(clock, settings.discoveryInterval());
        this.breakers = new CircuitBreakerRegistry(settings.breaker(), clock, this::onBreakerTransition);
        this.rateLimiter = new RateLimiter(settings.rateLimitRules(), clock, this::onRateLimited);
        this.healthChecker = new HealthChecker(probe, settings.healthCheck(), clock, new HealthEvents(),
                settings.healthCheckThreads());
        this.loadBalancer = new LoadBalancer(registry, healthChecker,
                settings.circuitBreakerEnabled() ? breakers : null, settings.strategy());
        this.connectionPool = new ConnectionPool(connectionFactory, settings.pool());

        this.maintenance = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "mesh-maintenance");
            t.setDaemon(true);
            return t;
        });
        AtomicInteger callThreads = new AtomicInteger();
        this.callExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "mesh-call-" + callThreads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    // --- Lifecycle ---

    /**
     * Starts background tasks and registers the configured services. Calling it again
     * while running does nothing.
     *
     * @return true if this call started the mesh
     * @throws IllegalStateException if the mesh was stopped
     */
    public boolean initialize() {
        if (!lifecycle.compareAndSet(MeshLifecycle.CREATED, MeshLifecycle.RUNNING)) {
            if (lifecycle.get() == MeshLifecycle.STOPPED) {
                throw new IllegalStateException("Service mesh is stopped and cannot be restarted");
            }
            return false;
        }
        long sweepMs = settings.cacheSweepInterval().toMillis();
        maintenance.scheduleWithFixedDelay(this::sweepCaches, sweepMs, sweepMs, TimeUnit.MILLISECONDS);
        long flushMs = settings.metricsFlushInterval().toMillis();
        maintenance.scheduleWithFixedDelay(this::flushMetrics, flushMs, flushMs, TimeUnit.MILLISECONDS);

        metrics.gauge("mesh.services", "Registered services", registry::size);
        metrics.gauge("mesh.endpoints.healthy", "Endpoints currently healthy", this::healthyEndpointCount);
        metrics.gauge("mesh.circuits.open", "Circuit breakers currently open", breakers::openCount);
        metrics.gauge("mesh.pool.active", "Pooled connections in use", connectionPool::totalActive);

        for (ServiceInfo info : settings.services()) {
            registerService(info, true);
        }
        log.info("Service mesh started: strategy={}, breakers={}, health checks={}, rate limiting={}, {} services",
                loadBalancer.getStrategyType(), settings.circuitBreakerEnabled(),
                settings.healthChecksEnabled(), settings.rateLimitingEnabled(), registry.size());
        publish("mesh.started", null, null, Map.of("services", registry.size()));
        return true;
    }

    /**
     * Cancels all background tasks and waits for them, closes pooled connections and
     * flushes metrics. Calls already handed to callers complete on their own.
     *
     * @return true if this call stopped the mesh, false if it was already stopped
     */
    public boolean stop() {
        MeshLifecycle previous = lifecycle.getAndSet(MeshLifecycle.STOPPED);
        if (previous == MeshLifecycle.STOPPED) {
            return false;
        }
        log.info("Stopping service mesh");
        maintenance.shutdownNow();
        awaitQuietly(maintenance, "maintenance");
        healthChecker.shutdown();
        callExecutor.shutdown();
        awaitQuietly(callExecutor, "call");
        connectionPool.close();
        metrics.flush();
        publish("mesh.stopped", null, null, Map.of());
        log.info("Service mesh stopped");
        return true;
    }

    private static void awaitQuietly(ExecutorService executor, String name) {
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Mesh {} threads did not finish within {}s", name, SHUTDOWN_TIMEOUT_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public MeshLifecycle getLifecycle() {
        return lifecycle.get();
    }

    // --- Registration ---

    public boolean registerService(ServiceInfo info) {
        return registerService(info, false);
    }

    /**
     * Registers (or with {@code replace}, re-registers) a service and starts probing its
     * endpoints. On replace, state of endpoints that disappeared is purged.
     *
     * @throws com.meshcontrol.core.error.InvalidServiceConfigurationException if the service is invalid
     * @throws com.meshcontrol.core.error.ServiceAlreadyRegisteredException    if it exists and replace is false
     */
    public boolean registerService(ServiceInfo info, boolean replace) {
        ensureNotStopped();
        if (info == null) {
            throw new InvalidServiceConfigurationException("Service definition is required");
        }
        synchronized (registrationLock(info.serviceId())) {
            return doRegister(info, replace);
        }
    }

    private boolean doRegister(ServiceInfo info, boolean replace) {
        Optional<ServiceInfo> previous = registry.register(info, replace);
        ServiceInfo stored = registry.require(info.serviceId());
        try {
            MdcContext.setService(stored.serviceId());
            previous.ifPresent(old -> {
                Set<String> kept = stored.endpoints().stream()
                        .map(ServiceEndpoint::endpointId)
                        .collect(Collectors.toSet());
                List<String> dropped = old.endpoints().stream()
                        .map(ServiceEndpoint::endpointId)
                        .filter(id -> !kept.contains(id))
                        .toList();
                purgeEndpoints(stored.serviceId(), dropped);
            });
            for (ServiceEndpoint endpoint : stored.endpoints()) {
                if (settings.healthChecksEnabled()) {
                    healthChecker.start(endpoint);
                } else {
                    healthChecker.track(endpoint);
                }
            }
            String action = previous.isPresent() ? "replaced" : "registered";
            log.info("Service {} {} with {} endpoints", stored.serviceId(), action, stored.endpoints().size());
            metrics.recordRegistration(action);
            publish("service." + action, stored.serviceId(), null,
                    Map.of("endpoints", stored.endpoints().size(), "version", stored.version()));
            return true;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Removes a service and every piece of state kept for it.
     *
     * @return false if the service was not registered
     */
    public boolean unregisterService(String serviceId) {
        List<String> endpointIds;
        int purged;
        synchronized (registrationLock(serviceId)) {
            Optional<ServiceInfo> removed = registry.unregister(serviceId);
            if (removed.isEmpty()) {
                return false;
            }
            endpointIds = removed.get().endpoints().stream().map(ServiceEndpoint::endpointId).toList();
            purgeEndpoints(serviceId, endpointIds);
            purged = rateLimiter.purgeResource(serviceId);
        }
        metrics.forget(serviceId);
        metrics.recordRegistration("unregistered");
        log.info("Service {} unregistered ({} endpoints, {} rate-limit entries purged)",
                serviceId, endpointIds.size(), purged);
        publish("service.unregistered", serviceId, null, Map.of("endpoints", endpointIds.size()));
        return true;
    }

    private Object registrationLock(String serviceId) {
        int hash = serviceId == null ? 0 : serviceId.hashCode();
        return registrationLocks[Math.floorMod(hash, registrationLocks.length)];
    }

    private void purgeEndpoints(String serviceId, List<String> endpointIds) {
        if (endpointIds.isEmpty()) {
            return;
        }
        healthChecker.stopAll(endpointIds);
        breakers.removeAll(endpointIds);
        loadBalancer.forget(serviceId, endpointIds);
        connectionPool.closeEndpoints(endpointIds);
    }

    // --- Routing ---

    /**
     * Selects an endpoint for the next call and counts the call as in flight. When circuit
     * breaking is enabled this also takes a breaker permit. The caller must report the
     * call's outcome through {@link #recordOutcome}.
     */
    public ServiceEndpoint getServiceEndpoint(String serviceId) {
        try {
            ServiceEndpoint endpoint = loadBalancer.selectEndpoint(serviceId);
            loadBalancer.callStarted(endpoint.endpointId());
            return endpoint;
        } catch (CircuitBreakerOpenException e) {
            metrics.recordRejection(serviceId, "circuit_open");
            throw e;
        } catch (ServiceUnavailableException e) {
            metrics.recordRejection(serviceId, "unavailable");
            throw e;
        } catch (ServiceNotFoundException e) {
            metrics.recordRejection(serviceId, "not_found");
            throw e;
        }
    }

    /**
     * Like {@link #getServiceEndpoint} for callers that will not make the call through the
     * mesh: the in-flight slot and breaker permit taken by the selection are returned at once.
     */
    public ServiceEndpoint previewServiceEndpoint(String serviceId) {
        ServiceEndpoint endpoint = getServiceEndpoint(serviceId);
        loadBalancer.callFinished(endpoint.endpointId(), 0, false);
        if (settings.circuitBreakerEnabled()) {
            breakers.releasePermit(endpoint.endpointId());
        }
        return endpoint;
    }

    /** Feeds the result of a call made outside {@link #invoke} back into breaker, balancer and metrics. */
    public void recordOutcome(ServiceEndpoint endpoint, boolean success, long latencyMs) {
        if (settings.circuitBreakerEnabled()) {
            if (success) {
                breakers.recordSuccess(endpoint.endpointId());
            } else {
                breakers.recordFailure(endpoint.endpointId());
            }
        }
        loadBalancer.callFinished(endpoint.endpointId(), latencyMs, true);
        metrics.recordRequest(endpoint.serviceId(), success, latencyMs);
    }

    public boolean allow(String clientKey, String resourceKey) {
        return allow(clientKey, resourceKey, 1);
    }

    public boolean allow(String clientKey, String resourceKey, int cost) {
        return checkRateLimit(clientKey, resourceKey, cost).allowed();
    }

    public RateLimitDecision checkRateLimit(String clientKey, String resourceKey, int cost) {
        if (!settings.rateLimitingEnabled()) {
            return RateLimitDecision.unlimited();
        }
        RateLimitDecision decision = rateLimiter.check(clientKey, resourceKey, cost);
        if (decision.isLimited()) {
            metrics.recordRateLimitDecision(decision.ruleName(), decision.allowed());
        }
        return decision;
    }

    /**
     * Routes {@code request} to an endpoint of {@code serviceId}: rate limit, endpoint
     * selection, pooled connection, transport call. The outcome is fed back to the breaker
     * and the metrics. Failures complete the returned future exceptionally with a
     * {@link MeshException}; nothing is thrown to the caller directly.
     */
    public CompletableFuture<ServiceResponse> invoke(String serviceId, ServiceRequest request, String clientKey) {
        if (lifecycle.get() == MeshLifecycle.STOPPED) {
            return CompletableFuture.failedFuture(new IllegalStateException("Service mesh is stopped"));
        }
        ServiceEndpoint endpoint;
        try {
            MdcContext.setClient(clientKey, serviceId);
            RateLimitDecision decision = checkRateLimit(clientKey, serviceId, 1);
            if (!decision.allowed()) {
                metrics.recordRejection(serviceId, "rate_limited");
                return CompletableFuture.failedFuture(
                        new RateLimitExceededException(clientKey, serviceId, decision.retryAfterMillis()));
            }
            endpoint = getServiceEndpoint(serviceId);
        } catch (MeshException e) {
            return CompletableFuture.failedFuture(e);
        } finally {
            MdcContext.clear();
        }

        long waitStart = System.nanoTime();
        return connectionPool.acquire(endpoint)
                .whenComplete((lease, error) -> {
                    if (error != null) {
                        abandonCall(endpoint, error);
                    } else {
                        metrics.recordPoolWait(serviceId,
                                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - waitStart));
                    }
                })
                .thenCompose(lease -> dispatch(endpoint, lease, request));
    }

    private CompletableFuture<ServiceResponse> dispatch(ServiceEndpoint endpoint, PooledConnection lease,
                                                        ServiceRequest request) {
        try {
            return CompletableFuture.supplyAsync(() -> call(endpoint, lease, request), callExecutor);
        } catch (RejectedExecutionException e) {
            lease.close();
            abandonCall(endpoint, e);
            return CompletableFuture.failedFuture(new ServiceUnavailableException(endpoint.serviceId(),
                    "Service mesh is stopping; call to " + endpoint.endpointId() + " not sent"));
        }
    }

    private ServiceResponse call(ServiceEndpoint endpoint, PooledConnection lease, ServiceRequest request) {
        long start = System.nanoTime();
        try (lease) {
            MdcContext.setEndpoint(endpoint.serviceId(), endpoint.endpointId());
            ServiceResponse response;
            try {
                response = transport.execute(lease.connection(), request);
            } catch (IOException | RuntimeException e) {
                lease.invalidate();
                long elapsed = elapsedMs(start);
                recordOutcome(endpoint, false, elapsed);
                log.debug("Call to {} failed after {}ms: {}", endpoint.endpointId(), elapsed, e.getMessage());
                throw new CompletionException(new MeshException(
                        "Call to " + endpoint.endpointId() + " failed: " + e.getMessage(), e));
            }
            long elapsed = elapsedMs(start);
            recordOutcome(endpoint, response.isSuccess(), elapsed);
            return response.responseTimeMs() > 0 ? response : response.withResponseTime(elapsed);
        } finally {
            MdcContext.clear();
        }
    }

    // The call never reached the endpoint: give back the breaker permit without an outcome.
    private void abandonCall(ServiceEndpoint endpoint, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        loadBalancer.callFinished(endpoint.endpointId(), 0, false);
        if (settings.circuitBreakerEnabled()) {
            breakers.releasePermit(endpoint.endpointId());
        }
        String reason;
        if (cause instanceof ConnectionPoolTimeoutException) {
            reason = "pool_timeout";
        } else if (cause instanceof RejectedExecutionException) {
            reason = "mesh_stopping";
        } else {
            reason = "connection_failed";
        }
        metrics.recordRejection(endpoint.serviceId(), reason);
        log.debug("No connection to {}: {}", endpoint.endpointId(), cause.getMessage());
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    public void setLoadBalancingStrategy(StrategyType type) {
        StrategyType previous = loadBalancer.getStrategyType();
        loadBalancer.setStrategy(type);
        if (previous != type) {
            publish("mesh.strategy_changed", null, null, Map.of("from", previous.name(), "to", type.name()));
        }
    }

    public StrategyType getLoadBalancingStrategy() {
        return loadBalancer.getStrategyType();
    }

    public void addRateLimitRule(RateLimitRule rule) {
        rateLimiter.addRule(rule);
    }

    public boolean removeRateLimitRule(String name) {
        return rateLimiter.removeRule(name);
    }

    public List<RateLimitRule> getRateLimitRules() {
        return rateLimiter.getRules();
    }

    // --- Status ---

    /**
     * @throws ServiceNotFoundException if the service is not registered
     */
    public ServiceStatusView getServiceStatus(String serviceId) {
        ServiceInfo info = registry.require(serviceId);
        List<EndpointStatus> endpoints = new ArrayList<>();
        Map<String, CircuitState> breakerStates = new LinkedHashMap<>();
        int healthy = 0;
        for (ServiceEndpoint endpoint : info.endpoints()) {
            String id = endpoint.endpointId();
            boolean isHealthy = healthChecker.isHealthy(id);
            if (isHealthy) {
                healthy++;
            }
            CircuitState state = breakers.getState(id);
            breakerStates.put(id, state);
            Optional<HealthCheckResult> result = healthChecker.result(id);
            int failures = breakers.snapshot(id).map(CircuitBreakerState::consecutiveFailures).orElse(0);
            endpoints.add(new EndpointStatus(id, endpoint.url(), endpoint.weight(), isHealthy, state, failures,
                    loadBalancer.inFlight(id), connectionPool.activeCount(id),
                    result.map(HealthCheckResult::latencyMs).orElse(0L),
                    result.map(HealthCheckResult::lastChecked).orElse(null),
                    result.map(HealthCheckResult::lastError).orElse(null)));
        }
        return new ServiceStatusView(info.serviceId(), info.name(), info.description(), info.type(),
                info.version(), ServiceHealth.of(healthy, info.endpoints().size()), info.registeredAt(),
                healthy, info.endpoints().size(), endpoints, breakerStates, info.dependencies(),
                metrics.stats(serviceId));
    }

    public MeshStatus getMeshStatus() {
        RequestStats totals = metrics.totals();
        Map<String, Boolean> features = new LinkedHashMap<>();
        features.put("circuit_breaker", settings.circuitBreakerEnabled());
        features.put("health_checks", settings.healthChecksEnabled());
        features.put("rate_limiting", settings.rateLimitingEnabled());
        return new MeshStatus(lifecycle.get(), registry.size(), registry.endpointCount(), healthyEndpointCount(),
                breakers.openCount(), loadBalancer.getStrategyType(), totals.total(), totals.successful(),
                totals.failed(), totals.averageResponseTimeMs(), rateLimiter.getRejectedCount(),
                connectionPool.totalActive(), features, clock.instant());
    }

    public List<ServiceInfo> getServices() {
        return registry.all();
    }

    public Optional<ServiceInfo> getService(String serviceId) {
        return registry.get(serviceId);
    }

    private int healthyEndpointCount() {
        int healthy = 0;
        for (ServiceInfo info : registry.all()) {
            for (ServiceEndpoint endpoint : info.endpoints()) {
                if (healthChecker.isHealthy(endpoint.endpointId())) {
                    healthy++;
                }
            }
        }
        return healthy;
    }

    /** Probes every endpoint of a service now, on the calling thread. */
    public List<HealthCheckResult> checkHealthNow(String serviceId) {
        ServiceInfo info = registry.require(serviceId);
        return info.endpoints().stream().map(healthChecker::checkNow).toList();
    }

    // --- Background tasks ---

    void sweepCaches() {
        try {
            int registryEntries = registry.sweep();
            int limiterEntries = rateLimiter.sweep();
            if (registryEntries + limiterEntries > 0) {
                log.debug("Swept {} discovery and {} rate-limit entries", registryEntries, limiterEntries);
            }
        } catch (RuntimeException e) {
            log.warn("Cache sweep failed: {}", e.getMessage(), e);
        }
    }

    void flushMetrics() {
        try {
            metrics.flush();
        } catch (RuntimeException e) {
            log.warn("Metrics flush failed: {}", e.getMessage(), e);
        }
    }

    // --- Listeners ---

    private void onBreakerTransition(CircuitState from, CircuitState to, CircuitBreakerState state) {
        String serviceId = registry.ownerOf(state.endpointId()).orElse("unknown");
        if (to == CircuitState.OPEN) {
            log.warn("Circuit for {} ({}) {} -> {} after {} consecutive failures, open for {}ms",
                    state.endpointId(), serviceId, from, to, state.consecutiveFailures(),
                    state.openTimeout().toMillis());
        } else {
            log.info("Circuit for {} ({}) {} -> {}", state.endpointId(), serviceId, from, to);
        }
        metrics.recordBreakerTransition(serviceId, from, to);
        publish("circuit." + to.name().toLowerCase(), serviceId, state.endpointId(),
                Map.of("from", from.name(), "to", to.name()));
    }

    private void onRateLimited(String clientKey, String resourceKey, RateLimitDecision decision) {
        log.info("Rate limit {} rejected client {} on {} (retry after {}ms)",
                decision.ruleName(), clientKey, resourceKey, decision.retryAfterMillis());
    }

    private final class HealthEvents implements HealthCheckListener {

        @Override
        public void onProbe(ServiceEndpoint endpoint, HealthCheckResult result) {
            metrics.recordHealthCheck(endpoint.serviceId(), result.consecutiveFailures() == 0, result.latencyMs());
        }

        @Override
        public void onHealthChanged(ServiceEndpoint endpoint, HealthCheckResult result) {
            metrics.recordHealthChange(endpoint.serviceId(), result.healthy());
            publish(result.healthy() ? "endpoint.healthy" : "endpoint.unhealthy",
                    endpoint.serviceId(), endpoint.endpointId(),
                    result.lastError() == null ? Map.of() : Map.of("error", result.lastError()));
        }
    }

    private void publish(String type, String serviceId, String endpointId, Map<String, Object> payload) {
        eventBus.publish(new MeshEvent(type, serviceId, endpointId, payload, clock.instant()));
    }

    private void ensureNotStopped() {
        if (lifecycle.get() == MeshLifecycle.STOPPED) {
            throw new IllegalStateException("Service mesh is stopped");
        }
    }

    // Exposed for tests in this package.
    HealthChecker healthChecker() {
        return healthChecker;
    }

    CircuitBreakerRegistry breakers() {
        return breakers;
    }

    ConnectionPool connectionPool() {
        return connectionPool;
    }

    ExecutorService callExecutor() {
        return callExecutor;
    }
}
