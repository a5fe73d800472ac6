package com.meshcontrol.core.balancer;

import com.meshcontrol.core.error.ServiceUnavailableException;
import com.meshcontrol.core.model.ServiceEndpoint;

import java.util.List;
import java.util.Random;
import java.util.function.Supplier;

/**
 * Random choice with probability proportional to endpoint weight. Endpoints with weight
 * zero are never picked.
 */
public class WeightedRandomStrategy implements LoadBalancingStrategy {

    private final Supplier<? extends Random> random;

    public WeightedRandomStrategy(Supplier<? extends Random> random) {
        this.random = random;
    }

    @Override
    public ServiceEndpoint select(String serviceId, List<ServiceEndpoint> candidates) {
        long total = 0;
        for (ServiceEndpoint candidate : candidates) {
            total += Math.max(0, candidate.weight());
        }
        if (total <= 0) {
            throw new ServiceUnavailableException(serviceId,
                    "No endpoint with positive weight available for service " + serviceId);
        }
        long point = (long) (random.get().nextDouble() * total);
        for (ServiceEndpoint candidate : candidates) {
            int weight = candidate.weight();
            if (weight <= 0) {
                continue;
            }
            if (point < weight) {
                return candidate;
            }
            point -= weight;
        }
        // rounding at the top of the range
        for (int i = candidates.size() - 1; i >= 0; i--) {
            if (candidates.get(i).weight() > 0) {
                return candidates.get(i);
            }
        }
        throw new IllegalStateException("unreachable");
    }

    @Override
    public StrategyType type() {
        return StrategyType.WEIGHTED_RANDOM;
    }
}
