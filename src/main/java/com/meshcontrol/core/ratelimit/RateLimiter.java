package com.meshcontrol.core.ratelimit;

import com.meshcontrol.core.cache.TtlCache;
import com.meshcontrol.core.error.InvalidServiceConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Applies the first rule whose pattern matches a resource key, keeping one limiter state
 * per (client, resource) pair.
 * <p>
 * States live in a {@link TtlCache} and expire once idle long enough to be equivalent to
 * fresh ones. Each state is locked on its own, so unrelated clients never contend.
 * Resources without a matching rule are not limited.
 */
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final CopyOnWriteArrayList<BoundRule> rules = new CopyOnWriteArrayList<>();
    private final TtlCache<RateLimitKey, RateLimitState> states;
    private final Clock clock;
    private final RateLimitListener listener;

    private final AtomicLong allowedCount = new AtomicLong();
    private final AtomicLong rejectedCount = new AtomicLong();

    public RateLimiter(Collection<RateLimitRule> rules, Clock clock, RateLimitListener listener) {
        this.clock = clock;
        this.listener = listener == null ? RateLimitListener.NO_OP : listener;
        this.states = new TtlCache<>(clock);
        if (rules != null) {
            for (RateLimitRule rule : rules) {
                addRule(rule);
            }
        }
    }

    public boolean allow(String clientKey, String resourceKey) {
        return allow(clientKey, resourceKey, 1);
    }

    public boolean allow(String clientKey, String resourceKey, int cost) {
        return check(clientKey, resourceKey, cost).allowed();
    }

    public RateLimitDecision check(String clientKey, String resourceKey, int cost) {
        if (cost <= 0) {
            throw new IllegalArgumentException("cost must be > 0, got " + cost);
        }
        BoundRule bound = match(resourceKey);
        if (bound == null) {
            allowedCount.incrementAndGet();
            return RateLimitDecision.unlimited();
        }
        RateLimitRule rule = bound.rule();
        var key = new RateLimitKey(clientKey, resourceKey);
        RateLimitState state = states.getOrCreate(key, k -> rule.newState(clock), rule.idleTtl());

        RateLimitDecision decision;
        synchronized (state) {
            boolean allowed = state.tryAcquire(cost);
            long remaining = state.remaining();
            long retryAfter = allowed ? 0 : state.retryAfterMillis(cost);
            decision = new RateLimitDecision(allowed, rule.name(), remaining, retryAfter);
        }

        if (decision.allowed()) {
            allowedCount.incrementAndGet();
        } else {
            rejectedCount.incrementAndGet();
            listener.onRejected(clientKey, resourceKey, decision);
        }
        return decision;
    }

    /**
     * Adds a rule at the end of the match order.
     *
     * @throws InvalidServiceConfigurationException if a rule with the same name exists
     */
    public void addRule(RateLimitRule rule) {
        synchronized (rules) {
            for (BoundRule existing : rules) {
                if (existing.rule().name().equals(rule.name())) {
                    throw new InvalidServiceConfigurationException("Duplicate rate limit rule: " + rule.name());
                }
            }
            BoundRule bound = new BoundRule(rule, Pattern.compile(rule.resourcePattern()));
            rules.add(bound);
            // resources that now resolve to a different rule must start from fresh state
            states.invalidateIf(k -> bound.matches(k.resourceKey()));
        }
        log.info("Added rate limit rule {} ({}) for resources matching '{}'",
                rule.name(), rule.algorithm(), rule.resourcePattern());
    }

    public boolean removeRule(String name) {
        synchronized (rules) {
            for (BoundRule bound : rules) {
                if (bound.rule().name().equals(name)) {
                    rules.remove(bound);
                    states.invalidateIf(k -> bound.matches(k.resourceKey()));
                    log.info("Removed rate limit rule {}", name);
                    return true;
                }
            }
        }
        return false;
    }

    public List<RateLimitRule> getRules() {
        return rules.stream().map(BoundRule::rule).toList();
    }

    /** Drops all state kept for {@code resourceKey}, for every client. */
    public int purgeResource(String resourceKey) {
        return states.invalidateIf(k -> k.resourceKey().equals(resourceKey));
    }

    /** Removes idle entries; returns how many were removed. */
    public int sweep() {
        return states.sweep();
    }

    public long getAllowedCount() {
        return allowedCount.get();
    }

    public long getRejectedCount() {
        return rejectedCount.get();
    }

    public int trackedEntries() {
        return states.size();
    }

    private BoundRule match(String resourceKey) {
        for (BoundRule bound : rules) {
            if (bound.matches(resourceKey)) {
                return bound;
            }
        }
        return null;
    }

    private record BoundRule(RateLimitRule rule, Pattern pattern) {
        boolean matches(String resourceKey) {
            return resourceKey != null && pattern.matcher(resourceKey).matches();
        }
    }
}
