package com.meshcontrol.core.balancer;

import com.meshcontrol.core.model.ServiceEndpoint;

import java.util.List;

/**
 * Picks the candidate with the fewest calls in flight; ties go to the earliest registered.
 */
public class LeastConnectionsStrategy implements LoadBalancingStrategy {

    private final InFlightTracker inFlight;

    public LeastConnectionsStrategy(InFlightTracker inFlight) {
        this.inFlight = inFlight;
    }

    @Override
    public ServiceEndpoint select(String serviceId, List<ServiceEndpoint> candidates) {
        ServiceEndpoint best = null;
        int bestCount = Integer.MAX_VALUE;
        for (ServiceEndpoint candidate : candidates) {
            int count = inFlight.get(candidate.endpointId());
            if (count < bestCount) {
                best = candidate;
                bestCount = count;
            }
        }
        return best;
    }

    @Override
    public StrategyType type() {
        return StrategyType.LEAST_CONNECTIONS;
    }
}
