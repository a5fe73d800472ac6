package com.meshcontrol.core.ratelimit;

import com.meshcontrol.core.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class TokenBucketTest {

    private final RateLimitRule rule = RateLimitRule.tokenBucket("api", ".*", 5, 1.0);
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
    }

    @Test
    @DisplayName("Five immediate calls pass, the sixth fails, one more passes after a second")
    void burstThenRefill() {
        TokenBucket bucket = new TokenBucket(rule, clock);
        for (int i = 0; i < 5; i++) {
            assertTrue(bucket.tryAcquire(1), "call " + (i + 1));
        }
        assertFalse(bucket.tryAcquire(1));
        assertEquals(1000, bucket.retryAfterMillis(1));

        clock.advanceMillis(1000);
        assertTrue(bucket.tryAcquire(1));
        assertFalse(bucket.tryAcquire(1));
    }

    @Test
    @DisplayName("Refill never exceeds capacity")
    void refillCapped() {
        TokenBucket bucket = new TokenBucket(rule, clock);
        bucket.tryAcquire(5);
        assertEquals(0, bucket.remaining());

        clock.advance(Duration.ofMinutes(1));
        assertEquals(5, bucket.remaining());
        assertFalse(bucket.tryAcquire(6));
    }

    @Test
    @DisplayName("A rejected request consumes nothing")
    void rejectionConsumesNothing() {
        TokenBucket bucket = new TokenBucket(rule, clock);
        assertTrue(bucket.tryAcquire(3));
        assertFalse(bucket.tryAcquire(3));
        assertEquals(2, bucket.remaining());
        assertTrue(bucket.tryAcquire(2));
    }

    @Test
    @DisplayName("A cost above capacity can never pass")
    void costAboveCapacity() {
        TokenBucket bucket = new TokenBucket(rule, clock);
        assertFalse(bucket.tryAcquire(6));
        assertFalse(bucket.tryAcquire(Integer.MAX_VALUE));
        assertEquals(Long.MAX_VALUE, bucket.retryAfterMillis(6));
        assertEquals(5, bucket.remaining());
    }

    @Test
    @DisplayName("Fractional refill rates wait for a whole token")
    void fractionalRate() {
        TokenBucket bucket = new TokenBucket(RateLimitRule.tokenBucket("slow", ".*", 2, 0.5), clock);
        assertTrue(bucket.tryAcquire(2));
        assertEquals(2000, bucket.retryAfterMillis(1));

        clock.advanceMillis(1999);
        assertFalse(bucket.tryAcquire(1));
        clock.advanceMillis(1);
        assertTrue(bucket.tryAcquire(1));
    }

    @Test
    @DisplayName("Over any interval T at most capacity + rate * T units are admitted")
    void admissionsBoundedByCapacityPlusRefill() {
        RateLimitRule fast = RateLimitRule.tokenBucket("fast", ".*", 10, 4.0);
        TokenBucket bucket = new TokenBucket(fast, clock);
        Random random = new Random(7L);

        List<long[]> admitted = new ArrayList<>();
        long elapsed = 0;
        for (int i = 0; i < 600; i++) {
            long step = random.nextInt(4) == 0 ? random.nextInt(2_000) : random.nextInt(50);
            clock.advanceMillis(step);
            elapsed += step;
            int cost = 1 + random.nextInt(3);
            if (bucket.tryAcquire(cost)) {
                admitted.add(new long[]{elapsed, cost});
            }
        }

        assertFalse(admitted.isEmpty());
        for (int from = 0; from < admitted.size(); from++) {
            long units = 0;
            for (int to = from; to < admitted.size(); to++) {
                units += admitted.get(to)[1];
                long spanMillis = admitted.get(to)[0] - admitted.get(from)[0];
                double bound = fast.capacity() + fast.refillPerSecond() * spanMillis / 1000.0;
                assertTrue(units <= bound + 1e-9,
                        units + " units admitted within " + spanMillis + "ms, bound " + bound);
            }
        }
    }
}
