package com.meshcontrol.core.ratelimit;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Iterator;

/**
 * Sliding-window log: one timestamp per accepted unit. A unit accepted at {@code t}
 * counts against every window that contains {@code t}, i.e. until {@code t + window}.
 */
final class SlidingWindow implements RateLimitState {

    private final RateLimitRule rule;
    private final int limit;
    private final long windowMillis;
    private final Clock clock;
    private final ArrayDeque<Long> timestamps = new ArrayDeque<>();

    SlidingWindow(RateLimitRule rule, Clock clock) {
        this.rule = rule;
        this.clock = clock;
        this.limit = rule.limit();
        this.windowMillis = rule.window().toMillis();
    }

    @Override
    public boolean tryAcquire(int cost) {
        long nowMillis = clock.millis();
        prune(nowMillis);
        if (cost > limit - timestamps.size()) {
            return false;
        }
        for (int i = 0; i < cost; i++) {
            timestamps.addLast(nowMillis);
        }
        return true;
    }

    @Override
    public long remaining() {
        prune(clock.millis());
        return Math.max(0, limit - timestamps.size());
    }

    @Override
    public long retryAfterMillis(int cost) {
        if (cost > limit) {
            return Long.MAX_VALUE;
        }
        long nowMillis = clock.millis();
        prune(nowMillis);
        int mustExpire = timestamps.size() + cost - limit;
        if (mustExpire <= 0) {
            return 0;
        }
        Iterator<Long> it = timestamps.iterator();
        long ts = 0;
        for (int i = 0; i < mustExpire && it.hasNext(); i++) {
            ts = it.next();
        }
        return Math.max(0, ts + windowMillis - nowMillis);
    }

    @Override
    public RateLimitRule rule() {
        return rule;
    }

    int size() {
        return timestamps.size();
    }

    private void prune(long nowMillis) {
        long cutoff = nowMillis - windowMillis;
        while (!timestamps.isEmpty() && timestamps.peekFirst() <= cutoff) {
            timestamps.pollFirst();
        }
    }
}
