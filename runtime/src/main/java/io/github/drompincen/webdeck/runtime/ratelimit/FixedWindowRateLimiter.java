package io.github.drompincen.webdeck.runtime.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Counts requests per key in fixed windows. The first request after a window has ended
 * starts a new one.
 */
public class FixedWindowRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(FixedWindowRateLimiter.class);

    private final String name;
    private final RateLimitPolicy policy;
    private final Clock clock;
    private final Map<String, Window> windows = new ConcurrentHashMap<>();

    public FixedWindowRateLimiter(String name, RateLimitPolicy policy, Clock clock) {
        this.name = name;
        this.policy = policy;
        this.clock = clock;
    }

    public RateLimitDecision tryAcquire(String key) {
        long now = clock.millis();
        RateLimitDecision[] decision = new RateLimitDecision[1];
        windows.compute(key, (k, window) -> {
            if (window == null || now >= window.resetAt()) {
                decision[0] = RateLimitDecision.allow(policy.maxRequests() - 1);
                return new Window(1, now + policy.window().toMillis());
            }
            if (window.count() >= policy.maxRequests()) {
                long retryAfter = Math.max(1, (long) Math.ceil((window.resetAt() - now) / 1000.0));
                decision[0] = RateLimitDecision.deny(retryAfter);
                return window;
            }
            int count = window.count() + 1;
            decision[0] = RateLimitDecision.allow(policy.maxRequests() - count);
            return new Window(count, window.resetAt());
        });
        if (!decision[0].allowed()) {
            log.warn("Rate limit {} exceeded for {}, retry after {}s", name, key, decision[0].retryAfterSeconds());
        }
        return decision[0];
    }

    /**
     * Like {@link #tryAcquire(String)} but throws when the request is denied.
     */
    public RateLimitDecision acquire(String key) {
        RateLimitDecision decision = tryAcquire(key);
        if (!decision.allowed()) {
            throw new RateLimitedException(name, decision.retryAfterSeconds());
        }
        return decision;
    }

    /** @return number of keys removed */
    public int evictExpired() {
        long now = clock.millis();
        int before = windows.size();
        windows.values().removeIf(window -> now >= window.resetAt());
        return Math.max(0, before - windows.size());
    }

    public String name() { return name; }

    public RateLimitPolicy policy() { return policy; }

    int trackedKeys() {
        return windows.size();
    }

    private record Window(int count, long resetAt) {}
}
