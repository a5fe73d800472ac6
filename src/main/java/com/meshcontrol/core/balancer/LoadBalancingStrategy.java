package com.meshcontrol.core.balancer;

import com.meshcontrol.core.model.ServiceEndpoint;

import java.util.Collection;
import java.util.List;

/**
 * Picks one endpoint among the current candidates of a service.
 * <p>
 * Implementations must be thread-safe, free of I/O and return one of the given candidates.
 */
public interface LoadBalancingStrategy {

    /**
     * @param serviceId  service being routed to
     * @param candidates healthy endpoints whose breakers admit calls, never empty
     */
    ServiceEndpoint select(String serviceId, List<ServiceEndpoint> candidates);

    StrategyType type();

    /** Drops any per-service state kept for {@code serviceId}. */
    default void forget(String serviceId, Collection<String> endpointIds) {}
}
