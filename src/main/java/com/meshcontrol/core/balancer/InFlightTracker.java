package com.meshcontrol.core.balancer;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counts calls currently in flight per endpoint.
 */
public class InFlightTracker {

    private final ConcurrentHashMap<String, AtomicInteger> counts = new ConcurrentHashMap<>();

    public int increment(String endpointId) {
        return counts.computeIfAbsent(endpointId, id -> new AtomicInteger()).incrementAndGet();
    }

    /** Never drops below zero. */
    public int decrement(String endpointId) {
        AtomicInteger count = counts.get(endpointId);
        if (count == null) {
            return 0;
        }
        return count.updateAndGet(c -> c > 0 ? c - 1 : 0);
    }

    public int get(String endpointId) {
        AtomicInteger count = counts.get(endpointId);
        return count == null ? 0 : count.get();
    }

    public void remove(String endpointId) {
        counts.remove(endpointId);
    }

    public int total() {
        return counts.values().stream().mapToInt(AtomicInteger::get).sum();
    }
}
