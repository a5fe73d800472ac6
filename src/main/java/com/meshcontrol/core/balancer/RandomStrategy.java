package com.meshcontrol.core.balancer;

import com.meshcontrol.core.model.ServiceEndpoint;

import java.util.List;
import java.util.Random;
import java.util.function.Supplier;

/**
 * Uniform random choice among the candidates.
 */
public class RandomStrategy implements LoadBalancingStrategy {

    private final Supplier<? extends Random> random;

    public RandomStrategy(Supplier<? extends Random> random) {
        this.random = random;
    }

    @Override
    public ServiceEndpoint select(String serviceId, List<ServiceEndpoint> candidates) {
        return candidates.get(random.get().nextInt(candidates.size()));
    }

    @Override
    public StrategyType type() {
        return StrategyType.RANDOM;
    }
}
