package com.meshcontrol.core.balancer;

import com.meshcontrol.core.model.ServiceEndpoint;

import java.util.List;

/**
 * Picks the candidate with the lowest average call latency. Endpoints without
 * observations count as zero, so new endpoints are tried first.
 */
public class LeastResponseTimeStrategy implements LoadBalancingStrategy {

    private final LatencyTracker latency;

    public LeastResponseTimeStrategy(LatencyTracker latency) {
        this.latency = latency;
    }

    @Override
    public ServiceEndpoint select(String serviceId, List<ServiceEndpoint> candidates) {
        ServiceEndpoint best = null;
        double bestLatency = Double.MAX_VALUE;
        for (ServiceEndpoint candidate : candidates) {
            double avg = latency.average(candidate.endpointId()).orElse(0);
            if (avg < bestLatency) {
                best = candidate;
                bestLatency = avg;
            }
        }
        return best;
    }

    @Override
    public StrategyType type() {
        return StrategyType.LEAST_RESPONSE_TIME;
    }
}
