package com.meshcontrol.core.cache;

import java.time.Duration;

/**
 * A cached value with the time-to-live applied whenever it is written.
 */
record CacheEntry<V>(V value, Duration ttl) {
}
