package com.meshcontrol.core.balancer;

import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Exponentially weighted moving average of call latency per endpoint.
 */
public class LatencyTracker {

    public static final double DEFAULT_ALPHA = 0.3;

    private final ConcurrentHashMap<String, Double> averages = new ConcurrentHashMap<>();
    private final double alpha;

    public LatencyTracker() {
        this(DEFAULT_ALPHA);
    }

    public LatencyTracker(double alpha) {
        if (alpha <= 0 || alpha > 1) {
            throw new IllegalArgumentException("alpha must be in (0, 1]: " + alpha);
        }
        this.alpha = alpha;
    }

    public void record(String endpointId, long latencyMs) {
        double sample = Math.max(0, latencyMs);
        averages.merge(endpointId, sample, (old, s) -> old + alpha * (s - old));
    }

    public OptionalDouble average(String endpointId) {
        Double avg = averages.get(endpointId);
        return avg == null ? OptionalDouble.empty() : OptionalDouble.of(avg);
    }

    public void remove(String endpointId) {
        averages.remove(endpointId);
    }
}
