package com.meshcontrol.core.ratelimit;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.EstimationProbe;
import io.github.bucket4j.TimeMeter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Token bucket backed by a Bucket4j local bucket: starts full and refills greedily at
 * {@code refillPerSecond} up to its capacity.
 */
final class TokenBucket implements RateLimitState {

    private final RateLimitRule rule;
    private final Bucket bucket;

    TokenBucket(RateLimitRule rule, Clock clock) {
        this.rule = rule;
        // a whole bucket refills over capacity / rate seconds
        Duration fullRefill = Duration.ofNanos(Math.round(rule.capacity() * 1_000_000_000d / rule.refillPerSecond()));
        Bandwidth bandwidth = Bandwidth.builder()
                .capacity(rule.capacity())
                .refillGreedy(rule.capacity(), fullRefill)
                .build();
        this.bucket = Bucket.builder()
                .addLimit(bandwidth)
                .withCustomTimePrecision(new ClockTimeMeter(clock))
                .build();
    }

    @Override
    public boolean tryAcquire(int cost) {
        return bucket.tryConsume(cost);
    }

    @Override
    public long remaining() {
        return bucket.getAvailableTokens();
    }

    @Override
    public long retryAfterMillis(int cost) {
        if (cost > rule.capacity()) {
            return Long.MAX_VALUE;
        }
        EstimationProbe probe = bucket.estimateAbilityToConsume(cost);
        if (probe.canBeConsumed()) {
            return 0;
        }
        long nanos = probe.getNanosToWaitForRefill();
        return (nanos + 999_999) / 1_000_000;
    }

    @Override
    public RateLimitRule rule() {
        return rule;
    }

    private record ClockTimeMeter(Clock clock) implements TimeMeter {

        @Override
        public long currentTimeNanos() {
            Instant now = clock.instant();
            return now.getEpochSecond() * 1_000_000_000L + now.getNano();
        }

        @Override
        public boolean isWallClockBased() {
            return true;
        }
    }
}
