package com.meshcontrol.core.balancer;

import com.meshcontrol.core.breaker.CircuitBreakerRegistry;
import com.meshcontrol.core.error.CircuitBreakerOpenException;
import com.meshcontrol.core.error.LoadBalancingException;
import com.meshcontrol.core.error.ServiceUnavailableException;
import com.meshcontrol.core.health.HealthView;
import com.meshcontrol.core.model.ServiceEndpoint;
import com.meshcontrol.core.registry.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Chooses the endpoint that serves the next call to a service.
 * <p>
 * Candidates are the endpoints that are healthy and whose circuit breaker admits calls.
 * The candidate set is built with the non-consuming breaker check; only the endpoint the
 * strategy picks takes a breaker permit. If that permit was lost to a concurrent caller
 * the endpoint is dropped and the strategy picks again among the rest.
 */
public class LoadBalancer {

    private static final Logger log = LoggerFactory.getLogger(LoadBalancer.class);

    private final ServiceRegistry registry;
    private final HealthView health;
    private final CircuitBreakerRegistry breakers;
    private final InFlightTracker inFlight;
    private final LatencyTracker latency;
    private final Map<StrategyType, LoadBalancingStrategy> strategies;
    private final AtomicReference<LoadBalancingStrategy> active = new AtomicReference<>();

    /**
     * @param breakers breaker registry, or {@code null} when circuit breaking is disabled
     */
    public LoadBalancer(ServiceRegistry registry, HealthView health, CircuitBreakerRegistry breakers,
                        StrategyType initial) {
        this(registry, health, breakers, initial, new InFlightTracker(), new LatencyTracker(),
                ThreadLocalRandom::current);
    }

    public LoadBalancer(ServiceRegistry registry, HealthView health, CircuitBreakerRegistry breakers,
                        StrategyType initial, InFlightTracker inFlight, LatencyTracker latency,
                        Supplier<? extends Random> random) {
        this.registry = registry;
        this.health = health;
        this.breakers = breakers;
        this.inFlight = inFlight;
        this.latency = latency;
        this.strategies = createStrategies(inFlight, latency, random);
        this.active.set(strategies.get(initial));
    }

    private static Map<StrategyType, LoadBalancingStrategy> createStrategies(
            InFlightTracker inFlight, LatencyTracker latency, Supplier<? extends Random> random) {
        Map<StrategyType, LoadBalancingStrategy> map = new ConcurrentHashMap<>();
        map.put(StrategyType.ROUND_ROBIN, new RoundRobinStrategy());
        map.put(StrategyType.LEAST_CONNECTIONS, new LeastConnectionsStrategy(inFlight));
        map.put(StrategyType.WEIGHTED_RANDOM, new WeightedRandomStrategy(random));
        map.put(StrategyType.RANDOM, new RandomStrategy(random));
        map.put(StrategyType.WEIGHTED_ROUND_ROBIN, new WeightedRoundRobinStrategy());
        map.put(StrategyType.LEAST_RESPONSE_TIME, new LeastResponseTimeStrategy(latency));
        return map;
    }

    /**
     * Selects an endpoint for {@code serviceId} and, when circuit breaking is on, takes
     * its breaker permit. The caller must report the outcome of the call.
     *
     * @throws com.meshcontrol.core.error.ServiceNotFoundException if the service is unknown
     * @throws ServiceUnavailableException                         if no endpoint is healthy
     * @throws CircuitBreakerOpenException                         if every healthy endpoint's breaker is open
     * @throws LoadBalancingException                              if the strategy returns a non-candidate
     */
    public ServiceEndpoint selectEndpoint(String serviceId) {
        List<ServiceEndpoint> endpoints = registry.endpoints(serviceId);

        List<ServiceEndpoint> healthy = new ArrayList<>(endpoints.size());
        for (ServiceEndpoint endpoint : endpoints) {
            if (health.isHealthy(endpoint.endpointId())) {
                healthy.add(endpoint);
            }
        }
        if (healthy.isEmpty()) {
            throw new ServiceUnavailableException(serviceId);
        }
        if (breakers == null) {
            return choose(serviceId, healthy);
        }

        List<ServiceEndpoint> candidates = new ArrayList<>(healthy.size());
        for (ServiceEndpoint endpoint : healthy) {
            if (breakers.isCallPermitted(endpoint.endpointId())) {
                candidates.add(endpoint);
            }
        }
        while (!candidates.isEmpty()) {
            ServiceEndpoint chosen = choose(serviceId, candidates);
            if (breakers.mayPass(chosen.endpointId())) {
                return chosen;
            }
            log.debug("Breaker permit for {} taken concurrently, reselecting", chosen.endpointId());
            candidates.remove(chosen);
        }
        throw new CircuitBreakerOpenException(serviceId, shortestRetryAfter(healthy));
    }

    private ServiceEndpoint choose(String serviceId, List<ServiceEndpoint> candidates) {
        LoadBalancingStrategy strategy = active.get();
        ServiceEndpoint chosen = strategy.select(serviceId, List.copyOf(candidates));
        if (chosen == null || !candidates.contains(chosen)) {
            throw new LoadBalancingException("Strategy " + strategy.type() + " returned "
                    + (chosen == null ? "no endpoint" : chosen.endpointId())
                    + ", which is not a candidate of service " + serviceId);
        }
        return chosen;
    }

    private Duration shortestRetryAfter(List<ServiceEndpoint> endpoints) {
        Duration shortest = null;
        for (ServiceEndpoint endpoint : endpoints) {
            Duration retry = breakers.retryAfter(endpoint.endpointId());
            if (shortest == null || retry.compareTo(shortest) < 0) {
                shortest = retry;
            }
        }
        return shortest == null ? Duration.ZERO : shortest;
    }

    public void setStrategy(StrategyType type) {
        LoadBalancingStrategy previous = active.getAndSet(strategies.get(type));
        if (previous.type() != type) {
            log.info("Load-balancing strategy changed from {} to {}", previous.type(), type);
        }
    }

    public StrategyType getStrategyType() {
        return active.get().type();
    }

    /** Registers a caller-supplied strategy in place of the built-in one of the same type. */
    public void setStrategy(LoadBalancingStrategy strategy) {
        strategies.put(strategy.type(), strategy);
        active.set(strategy);
    }

    /** Call accounting used by the least-connections and least-response-time strategies. */
    public void callStarted(String endpointId) {
        inFlight.increment(endpointId);
    }

    public void callFinished(String endpointId, long latencyMs, boolean measured) {
        inFlight.decrement(endpointId);
        if (measured) {
            latency.record(endpointId, latencyMs);
        }
    }

    public int inFlight(String endpointId) {
        return inFlight.get(endpointId);
    }

    /** Drops per-service strategy state and per-endpoint call accounting. */
    public void forget(String serviceId, Collection<String> endpointIds) {
        strategies.values().forEach(s -> s.forget(serviceId, endpointIds));
        for (String endpointId : endpointIds) {
            inFlight.remove(endpointId);
            latency.remove(endpointId);
        }
    }

    InFlightTracker inFlightTracker() {
        return inFlight;
    }

    LatencyTracker latencyTracker() {
        return latency;
    }
}
