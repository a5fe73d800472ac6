package com.meshcontrol.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw {@code mesh.*} configuration. Converted and validated by {@link MeshSettings#from}.
 */
@Component
@ConfigurationProperties(prefix = "mesh")
public class MeshProperties {

    private int discoveryIntervalSec = 30;
    private int healthCheckIntervalSec = 30;
    private int healthyThreshold = 2;
    private int unhealthyThreshold = 3;
    private int probeTimeoutMs = 2000;
    private int healthCheckThreads = 4;
    private String loadBalancingStrategy = "round_robin";
    private int metricsFlushIntervalSec = 60;
    private int cacheSweepIntervalSec = 30;
    private boolean circuitBreakerEnabled = true;
    private boolean healthChecksEnabled = true;
    private boolean rateLimitingEnabled = true;
    private Breaker breaker = new Breaker();
    private Pool pool = new Pool();
    private List<RateLimitRuleProperties> rateLimitRules = new ArrayList<>();
    private List<ServiceDefinition> services = new ArrayList<>();

    public int getDiscoveryIntervalSec() { return discoveryIntervalSec; }
    public void setDiscoveryIntervalSec(int discoveryIntervalSec) { this.discoveryIntervalSec = discoveryIntervalSec; }
    public int getHealthCheckIntervalSec() { return healthCheckIntervalSec; }
    public void setHealthCheckIntervalSec(int healthCheckIntervalSec) { this.healthCheckIntervalSec = healthCheckIntervalSec; }
    public int getHealthyThreshold() { return healthyThreshold; }
    public void setHealthyThreshold(int healthyThreshold) { this.healthyThreshold = healthyThreshold; }
    public int getUnhealthyThreshold() { return unhealthyThreshold; }
    public void setUnhealthyThreshold(int unhealthyThreshold) { this.unhealthyThreshold = unhealthyThreshold; }
    public int getProbeTimeoutMs() { return probeTimeoutMs; }
    public void setProbeTimeoutMs(int probeTimeoutMs) { this.probeTimeoutMs = probeTimeoutMs; }
    public int getHealthCheckThreads() { return healthCheckThreads; }
    public void setHealthCheckThreads(int healthCheckThreads) { this.healthCheckThreads = healthCheckThreads; }
    public String getLoadBalancingStrategy() { return loadBalancingStrategy; }
    public void setLoadBalancingStrategy(String loadBalancingStrategy) { this.loadBalancingStrategy = loadBalancingStrategy; }
    public int getMetricsFlushIntervalSec() { return metricsFlushIntervalSec; }
    public void setMetricsFlushIntervalSec(int metricsFlushIntervalSec) { this.metricsFlushIntervalSec = metricsFlushIntervalSec; }
    public int getCacheSweepIntervalSec() { return cacheSweepIntervalSec; }
    public void setCacheSweepIntervalSec(int cacheSweepIntervalSec) { this.cacheSweepIntervalSec = cacheSweepIntervalSec; }
    public boolean isCircuitBreakerEnabled() { return circuitBreakerEnabled; }
    public void setCircuitBreakerEnabled(boolean circuitBreakerEnabled) { this.circuitBreakerEnabled = circuitBreakerEnabled; }
    public boolean isHealthChecksEnabled() { return healthChecksEnabled; }
    public void setHealthChecksEnabled(boolean healthChecksEnabled) { this.healthChecksEnabled = healthChecksEnabled; }
    public boolean isRateLimitingEnabled() { return rateLimitingEnabled; }
    public void setRateLimitingEnabled(boolean rateLimitingEnabled) { this.rateLimitingEnabled = rateLimitingEnabled; }
    public Breaker getBreaker() { return breaker; }
    public void setBreaker(Breaker breaker) { this.breaker = breaker; }
    public Pool getPool() { return pool; }
    public void setPool(Pool pool) { this.pool = pool; }
    public List<RateLimitRuleProperties> getRateLimitRules() { return rateLimitRules; }
    public void setRateLimitRules(List<RateLimitRuleProperties> rateLimitRules) { this.rateLimitRules = rateLimitRules; }
    public List<ServiceDefinition> getServices() { return services; }
    public void setServices(List<ServiceDefinition> services) { this.services = services; }

    /** Breaker preset plus optional per-field overrides; unset overrides keep the preset's value. */
    public static class Breaker {
        private String preset = "default";
        private Integer failureThreshold;
        private Integer successThreshold;
        private Integer openTimeoutSec;
        private Integer halfOpenMaxCalls;
        private Double backoffMultiplier;
        private Integer maxOpenTimeoutSec;

        public String getPreset() { return preset; }
        public void setPreset(String preset) { this.preset = preset; }
        public Integer getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(Integer failureThreshold) { this.failureThreshold = failureThreshold; }
        public Integer getSuccessThreshold() { return successThreshold; }
        public void setSuccessThreshold(Integer successThreshold) { this.successThreshold = successThreshold; }
        public Integer getOpenTimeoutSec() { return openTimeoutSec; }
        public void setOpenTimeoutSec(Integer openTimeoutSec) { this.openTimeoutSec = openTimeoutSec; }
        public Integer getHalfOpenMaxCalls() { return halfOpenMaxCalls; }
        public void setHalfOpenMaxCalls(Integer halfOpenMaxCalls) { this.halfOpenMaxCalls = halfOpenMaxCalls; }
        public Double getBackoffMultiplier() { return backoffMultiplier; }
        public void setBackoffMultiplier(Double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }
        public Integer getMaxOpenTimeoutSec() { return maxOpenTimeoutSec; }
        public void setMaxOpenTimeoutSec(Integer maxOpenTimeoutSec) { this.maxOpenTimeoutSec = maxOpenTimeoutSec; }
    }

    public static class Pool {
        private int maxConnectionsPerEndpoint = 10;
        private int acquireTimeoutMs = 1000;
        private int connectTimeoutMs = 2000;

        public int getMaxConnectionsPerEndpoint() { return maxConnectionsPerEndpoint; }
        public void setMaxConnectionsPerEndpoint(int maxConnectionsPerEndpoint) { this.maxConnectionsPerEndpoint = maxConnectionsPerEndpoint; }
        public int getAcquireTimeoutMs() { return acquireTimeoutMs; }
        public void setAcquireTimeoutMs(int acquireTimeoutMs) { this.acquireTimeoutMs = acquireTimeoutMs; }
        public int getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(int connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }
    }

    public static class RateLimitRuleProperties {
        private String name;
        private String resourcePattern = ".*";
        private String algorithm = "token_bucket";
        private int capacity;
        private double refillPerSecond;
        private int limit;
        private int windowSec;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getResourcePattern() { return resourcePattern; }
        public void setResourcePattern(String resourcePattern) { this.resourcePattern = resourcePattern; }
        public String getAlgorithm() { return algorithm; }
        public void setAlgorithm(String algorithm) { this.algorithm = algorithm; }
        public int getCapacity() { return capacity; }
        public void setCapacity(int capacity) { this.capacity = capacity; }
        public double getRefillPerSecond() { return refillPerSecond; }
        public void setRefillPerSecond(double refillPerSecond) { this.refillPerSecond = refillPerSecond; }
        public int getLimit() { return limit; }
        public void setLimit(int limit) { this.limit = limit; }
        public int getWindowSec() { return windowSec; }
        public void setWindowSec(int windowSec) { this.windowSec = windowSec; }
    }

    /** A service registered at startup. */
    public static class ServiceDefinition {
        private String serviceId;
        private String name;
        private String description;
        private String type;
        private String version;
        private List<String> dependencies = new ArrayList<>();
        private List<EndpointDefinition> endpoints = new ArrayList<>();

        public String getServiceId() { return serviceId; }
        public void setServiceId(String serviceId) { this.serviceId = serviceId; }
        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }
        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
        public String getVersion() { return version; }
        public void setVersion(String version) { this.version = version; }
        public List<String> getDependencies() { return dependencies; }
        public void setDependencies(List<String> dependencies) { this.dependencies = dependencies; }
        public List<EndpointDefinition> getEndpoints() { return endpoints; }
        public void setEndpoints(List<EndpointDefinition> endpoints) { this.endpoints = endpoints; }
    }

    public static class EndpointDefinition {
        private String host;
        private int port;
        private String protocol = "http";
        private String path = "";
        private int weight = 1;
        private String healthCheckPath = "/health";
        private Map<String, String> metadata = new LinkedHashMap<>();

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }
        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }
        public String getProtocol() { return protocol; }
        public void setProtocol(String protocol) { this.protocol = protocol; }
        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
        public int getWeight() { return weight; }
        public void setWeight(int weight) { this.weight = weight; }
        public String getHealthCheckPath() { return healthCheckPath; }
        public void setHealthCheckPath(String healthCheckPath) { this.healthCheckPath = healthCheckPath; }
        public Map<String, String> getMetadata() { return metadata; }
        public void setMetadata(Map<String, String> metadata) { this.metadata = metadata; }
    }
}
