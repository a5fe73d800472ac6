package com.meshcontrol.core.balancer;

import com.meshcontrol.core.model.ServiceEndpoint;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Cycles through the candidates with one atomic position per service. The position is
 * kept below the current candidate count, so the rotation adapts as endpoints come and go
 * and the counter never wraps.
 */
public class RoundRobinStrategy implements LoadBalancingStrategy {

    private final ConcurrentHashMap<String, AtomicInteger> positions = new ConcurrentHashMap<>();

    @Override
    public ServiceEndpoint select(String serviceId, List<ServiceEndpoint> candidates) {
        int size = candidates.size();
        int current = positions.computeIfAbsent(serviceId, id -> new AtomicInteger())
                .getAndUpdate(i -> (int) ((i + 1L) % size));
        return candidates.get(current % size);
    }

    @Override
    public StrategyType type() {
        return StrategyType.ROUND_ROBIN;
    }

    @Override
    public void forget(String serviceId, Collection<String> endpointIds) {
        positions.remove(serviceId);
    }

    void startAt(String serviceId, int position) {
        positions.computeIfAbsent(serviceId, id -> new AtomicInteger()).set(position);
    }
}
