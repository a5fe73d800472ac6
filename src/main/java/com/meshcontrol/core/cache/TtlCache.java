package com.meshcontrol.core.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Caffeine cache whose entries each carry their own time-to-live.
 * <p>
 * Expired entries read as absent at and after their expiry instant. Entries that are
 * written but never read again are reclaimed by {@link #sweep()}, which the mesh runs
 * periodically. Time comes from the supplied {@link Clock}, adapted to a Caffeine
 * {@code Ticker}.
 *
 * @param <K> key type
 * @param <V> value type
 */
public class TtlCache<K, V> {

    private final Cache<K, CacheEntry<V>> cache;
    private final AtomicInteger expiredSinceSweep = new AtomicInteger();

    public TtlCache(Clock clock) {
        this.cache = Caffeine.newBuilder()
                .ticker(() -> nanos(clock.instant()))
                .expireAfter(new PerEntryExpiry<K, V>())
                // maintenance runs inline so expiry follows the clock deterministically
                .executor(Runnable::run)
                .evictionListener((K key, CacheEntry<V> entry, RemovalCause cause) -> {
                    if (cause == RemovalCause.EXPIRED) {
                        expiredSinceSweep.incrementAndGet();
                    }
                })
                .build();
    }

    public Optional<V> get(K key) {
        CacheEntry<V> entry = cache.getIfPresent(key);
        return entry == null ? Optional.empty() : Optional.ofNullable(entry.value());
    }

    public void set(K key, V value, Duration ttl) {
        cache.put(key, new CacheEntry<>(value, requirePositive(ttl)));
    }

    /**
     * Returns the live value for {@code key}, creating it with {@code factory} when absent
     * or expired. Every call pushes the entry's expiry to {@code now + ttl}, so the entry
     * only expires after {@code ttl} without access.
     */
    public V getOrCreate(K key, Function<? super K, ? extends V> factory, Duration ttl) {
        Duration checked = requirePositive(ttl);
        CacheEntry<V> entry = cache.asMap().compute(key, (k, existing) -> existing == null
                ? new CacheEntry<>(factory.apply(k), checked)
                : new CacheEntry<>(existing.value(), checked));
        return entry.value();
    }

    public void invalidate(K key) {
        cache.invalidate(key);
    }

    /** Removes every entry whose key matches; returns how many were removed. */
    public int invalidateIf(Predicate<? super K> predicate) {
        int removed = 0;
        for (K key : cache.asMap().keySet()) {
            if (predicate.test(key) && cache.asMap().remove(key) != null) {
                removed++;
            }
        }
        return removed;
    }

    /**
     * Evicts expired entries. Returns how many entries expired since the previous sweep,
     * including ones Caffeine reclaimed during other operations.
     */
    public int sweep() {
        cache.cleanUp();
        return expiredSinceSweep.getAndSet(0);
    }

    /** Number of live entries. */
    public int size() {
        cache.cleanUp();
        int live = 0;
        for (K ignored : cache.asMap().keySet()) {
            live++;
        }
        return live;
    }

    public void clear() {
        cache.invalidateAll();
        cache.cleanUp();
    }

    private static Duration requirePositive(Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
        return ttl;
    }

    private static long nanos(Instant instant) {
        return instant.getEpochSecond() * 1_000_000_000L + instant.getNano();
    }

    /** Writes reset the expiry to the entry's TTL; reads leave it unchanged. */
    private static final class PerEntryExpiry<K, V> implements Expiry<K, CacheEntry<V>> {

        @Override
        public long expireAfterCreate(K key, CacheEntry<V> entry, long currentTime) {
            return entry.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(K key, CacheEntry<V> entry, long currentTime, long currentDuration) {
            return entry.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(K key, CacheEntry<V> entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
