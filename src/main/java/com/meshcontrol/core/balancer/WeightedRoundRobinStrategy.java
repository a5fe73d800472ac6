package com.meshcontrol.core.balancer;

import com.meshcontrol.core.error.ServiceUnavailableException;
import com.meshcontrol.core.model.ServiceEndpoint;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Smooth weighted round robin: over any run of {@code sum(weights)} selections each
 * endpoint is chosen exactly {@code weight} times, spread out rather than in bursts.
 * Endpoints with weight zero are never picked.
 */
public class WeightedRoundRobinStrategy implements LoadBalancingStrategy {

    private final ConcurrentHashMap<String, Map<String, Long>> currentWeights = new ConcurrentHashMap<>();

    @Override
    public ServiceEndpoint select(String serviceId, List<ServiceEndpoint> candidates) {
        Map<String, Long> current = currentWeights.computeIfAbsent(serviceId, id -> new HashMap<>());
        synchronized (current) {
            Set<String> live = new HashSet<>();
            ServiceEndpoint best = null;
            long bestWeight = Long.MIN_VALUE;
            long total = 0;
            for (ServiceEndpoint candidate : candidates) {
                if (candidate.weight() <= 0) {
                    continue;
                }
                String id = candidate.endpointId();
                live.add(id);
                long weight = current.merge(id, (long) candidate.weight(), Long::sum);
                total += candidate.weight();
                if (weight > bestWeight) {
                    best = candidate;
                    bestWeight = weight;
                }
            }
            current.keySet().retainAll(live);
            if (best == null) {
                throw new ServiceUnavailableException(serviceId,
                        "No endpoint with positive weight available for service " + serviceId);
            }
            current.merge(best.endpointId(), -total, Long::sum);
            return best;
        }
    }

    @Override
    public StrategyType type() {
        return StrategyType.WEIGHTED_ROUND_ROBIN;
    }

    @Override
    public void forget(String serviceId, Collection<String> endpointIds) {
        currentWeights.remove(serviceId);
    }
}
