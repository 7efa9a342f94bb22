package io.github.drompincen.webdeck.runtime.ratelimit;

import java.time.Duration;

public record RateLimitPolicy(int maxRequests, Duration window) {

    public RateLimitPolicy {
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be positive: " + maxRequests);
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive: " + window);
        }
    }

    public static RateLimitPolicy perMinute(int maxRequests) {
        return new RateLimitPolicy(maxRequests, Duration.ofMinutes(1));
    }
}
