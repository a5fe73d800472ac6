package com.meshcontrol.core.config;

import com.meshcontrol.core.balancer.StrategyType;
import com.meshcontrol.core.breaker.CircuitBreakerConfig;
import com.meshcontrol.core.error.InvalidServiceConfigurationException;
import com.meshcontrol.core.health.HealthCheckConfig;
import com.meshcontrol.core.model.ServiceEndpoint;
import com.meshcontrol.core.model.ServiceInfo;
import com.meshcontrol.core.model.ServiceType;
import com.meshcontrol.core.pool.PoolConfig;
import com.meshcontrol.core.ratelimit.RateLimitAlgorithm;
import com.meshcontrol.core.ratelimit.RateLimitRule;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Validated mesh configuration, built once from {@link MeshProperties}.
 *
 * @param discoveryInterval    TTL of cached endpoint lookups
 * @param healthCheck          probe schedule and hysteresis
 * @param healthCheckThreads   size of the probe scheduler
 * @param breaker              breaker thresholds and backoff
 * @param pool                 connection pool bounds
 * @param rateLimitRules       rules in match order
 * @param strategy             initial load-balancing strategy
 * @param metricsFlushInterval period of the metrics flush task
 * @param cacheSweepInterval   period of the cache sweep task
 * @param circuitBreakerEnabled whether endpoint selection consults breakers
 * @param healthChecksEnabled  whether endpoints are probed
 * @param rateLimitingEnabled  whether {@code allow} enforces rules
 * @param services             services registered on startup
 */
public record MeshSettings(
    Duration discoveryInterval,
    HealthCheckConfig healthCheck,
    int healthCheckThreads,
    CircuitBreakerConfig breaker,
    PoolConfig pool,
    List<RateLimitRule> rateLimitRules,
    StrategyType strategy,
    Duration metricsFlushInterval,
    Duration cacheSweepInterval,
    boolean circuitBreakerEnabled,
    boolean healthChecksEnabled,
    boolean rateLimitingEnabled,
    List<ServiceInfo> services
) {

    public MeshSettings {
        requirePositive(discoveryInterval, "discoveryIntervalSec");
        requirePositive(metricsFlushInterval, "metricsFlushIntervalSec");
        requirePositive(cacheSweepInterval, "cacheSweepIntervalSec");
        if (healthCheckThreads < 1) {
            throw new InvalidServiceConfigurationException("healthCheckThreads must be >= 1");
        }
        rateLimitRules = rateLimitRules == null ? List.of() : List.copyOf(rateLimitRules);
        services = services == null ? List.of() : List.copyOf(services);
        Set<String> names = new HashSet<>();
        for (RateLimitRule rule : rateLimitRules) {
            if (!names.add(rule.name())) {
                throw new InvalidServiceConfigurationException("Duplicate rate limit rule: " + rule.name());
            }
        }
    }

    public static MeshSettings defaults() {
        return new MeshSettings(Duration.ofSeconds(30), HealthCheckConfig.DEFAULT, 4, CircuitBreakerConfig.DEFAULT,
                PoolConfig.DEFAULT, List.of(), StrategyType.ROUND_ROBIN, Duration.ofSeconds(60),
                Duration.ofSeconds(30), true, true, true, List.of());
    }

    /**
     * @throws InvalidServiceConfigurationException describing the first invalid setting
     */
    public static MeshSettings from(MeshProperties p) {
        HealthCheckConfig healthCheck = new HealthCheckConfig(
                seconds(p.getHealthCheckIntervalSec(), "healthCheckIntervalSec"),
                millis(p.getProbeTimeoutMs(), "probeTimeoutMs"),
                p.getUnhealthyThreshold(),
                p.getHealthyThreshold());
        PoolConfig pool = new PoolConfig(p.getPool().getMaxConnectionsPerEndpoint(),
                Duration.ofMillis(p.getPool().getAcquireTimeoutMs()));
        return new MeshSettings(
                seconds(p.getDiscoveryIntervalSec(), "discoveryIntervalSec"),
                healthCheck,
                p.getHealthCheckThreads(),
                breakerConfig(p.getBreaker()),
                pool,
                p.getRateLimitRules().stream().map(MeshSettings::rule).toList(),
                StrategyType.from(p.getLoadBalancingStrategy()),
                seconds(p.getMetricsFlushIntervalSec(), "metricsFlushIntervalSec"),
                seconds(p.getCacheSweepIntervalSec(), "cacheSweepIntervalSec"),
                p.isCircuitBreakerEnabled(),
                p.isHealthChecksEnabled(),
                p.isRateLimitingEnabled(),
                p.getServices().stream().map(MeshSettings::service).toList());
    }

    static CircuitBreakerConfig breakerConfig(MeshProperties.Breaker b) {
        CircuitBreakerConfig preset = CircuitBreakerConfig.preset(b.getPreset());
        return new CircuitBreakerConfig(
                b.getFailureThreshold() != null ? b.getFailureThreshold() : preset.failureThreshold(),
                b.getSuccessThreshold() != null ? b.getSuccessThreshold() : preset.successThreshold(),
                b.getOpenTimeoutSec() != null ? seconds(b.getOpenTimeoutSec(), "breaker.openTimeoutSec")
                        : preset.openTimeout(),
                b.getHalfOpenMaxCalls() != null ? b.getHalfOpenMaxCalls() : preset.halfOpenMaxCalls(),
                b.getBackoffMultiplier() != null ? b.getBackoffMultiplier() : preset.backoffMultiplier(),
                b.getMaxOpenTimeoutSec() != null ? seconds(b.getMaxOpenTimeoutSec(), "breaker.maxOpenTimeoutSec")
                        : preset.maxOpenTimeout());
    }

    static RateLimitRule rule(MeshProperties.RateLimitRuleProperties r) {
        RateLimitAlgorithm algorithm;
        try {
            algorithm = RateLimitAlgorithm.valueOf(r.getAlgorithm().trim().replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new InvalidServiceConfigurationException("Rule " + r.getName() + ": unknown algorithm "
                    + r.getAlgorithm());
        }
        return new RateLimitRule(r.getName(), r.getResourcePattern(), algorithm, r.getCapacity(),
                r.getRefillPerSecond(), r.getLimit(),
                algorithm == RateLimitAlgorithm.SLIDING_WINDOW ? Duration.ofSeconds(r.getWindowSec()) : null);
    }

    static ServiceInfo service(MeshProperties.ServiceDefinition d) {
        ServiceType type;
        try {
            type = d.getType() == null ? null : ServiceType.valueOf(d.getType().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidServiceConfigurationException("Service " + d.getServiceId() + ": unknown type "
                    + d.getType());
        }
        List<ServiceEndpoint> endpoints = new ArrayList<>();
        for (MeshProperties.EndpointDefinition e : d.getEndpoints()) {
            endpoints.add(new ServiceEndpoint(d.getServiceId(), e.getHost(), e.getPort(), e.getProtocol(),
                    e.getPath(), e.getWeight(), e.getMetadata(), e.getHealthCheckPath()));
        }
        return new ServiceInfo(d.getServiceId(), d.getName(), d.getDescription(), type, d.getVersion(),
                endpoints, d.getDependencies(), null);
    }

    private static Duration seconds(int value, String key) {
        if (value <= 0) {
            throw new InvalidServiceConfigurationException(key + " must be > 0, got " + value);
        }
        return Duration.ofSeconds(value);
    }

    private static Duration millis(int value, String key) {
        if (value <= 0) {
            throw new InvalidServiceConfigurationException(key + " must be > 0, got " + value);
        }
        return Duration.ofMillis(value);
    }

    private static void requirePositive(Duration d, String key) {
        if (d == null || d.isNegative() || d.isZero()) {
            throw new InvalidServiceConfigurationException(key + " must be positive");
        }
    }

    public MeshSettings withCircuitBreakerEnabled(boolean enabled) {
        return new MeshSettings(discoveryInterval, healthCheck, healthCheckThreads, breaker, pool, rateLimitRules,
                strategy, metricsFlushInterval, cacheSweepInterval, enabled, healthChecksEnabled,
                rateLimitingEnabled, services);
    }

    public MeshSettings withRateLimitRules(List<RateLimitRule> rules) {
        return new MeshSettings(discoveryInterval, healthCheck, healthCheckThreads, breaker, pool, rules,
                strategy, metricsFlushInterval, cacheSweepInterval, circuitBreakerEnabled, healthChecksEnabled,
                rateLimitingEnabled, services);
    }

    public MeshSettings withBreaker(CircuitBreakerConfig config) {
        return new MeshSettings(discoveryInterval, healthCheck, healthCheckThreads, config, pool, rateLimitRules,
                strategy, metricsFlushInterval, cacheSweepInterval, circuitBreakerEnabled, healthChecksEnabled,
                rateLimitingEnabled, services);
    }

    public MeshSettings withHealthCheck(HealthCheckConfig config) {
        return new MeshSettings(discoveryInterval, config, healthCheckThreads, breaker, pool, rateLimitRules,
                strategy, metricsFlushInterval, cacheSweepInterval, circuitBreakerEnabled, healthChecksEnabled,
                rateLimitingEnabled, services);
    }

    public MeshSettings withPool(PoolConfig config) {
        return new MeshSettings(discoveryInterval, healthCheck, healthCheckThreads, breaker, config, rateLimitRules,
                strategy, metricsFlushInterval, cacheSweepInterval, circuitBreakerEnabled, healthChecksEnabled,
                rateLimitingEnabled, services);
    }

    public MeshSettings withServices(List<ServiceInfo> bootstrap) {
        return new MeshSettings(discoveryInterval, healthCheck, healthCheckThreads, breaker, pool, rateLimitRules,
                strategy, metricsFlushInterval, cacheSweepInterval, circuitBreakerEnabled, healthChecksEnabled,
                rateLimitingEnabled, bootstrap);
    }
}
