package com.meshcontrol.core.metrics;

/**
 * Request totals for one service, or for the whole mesh.
 */
public record RequestStats(
    long total,
    long successful,
    long failed,
    double averageResponseTimeMs
) {

    public static final RequestStats EMPTY = new RequestStats(0, 0, 0, 0.0);

    public double successRate() {
        return total == 0 ? 0.0 : (double) successful / total;
    }
}
