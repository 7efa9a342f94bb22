package io.github.drompincen.webdeck.runtime.ratelimit;

import io.github.drompincen.webdeck.runtime.config.WebDeckProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * The limiters guarding the HTTP surface: device-auth writes, device-auth reads and
 * stream starts.
 */
@Component
public class RateLimiters {

    private final FixedWindowRateLimiter authWrite;
    private final FixedWindowRateLimiter authRead;
    private final FixedWindowRateLimiter stream;

    public RateLimiters(WebDeckProperties properties, Clock clock) {
        WebDeckProperties.RateLimit limits = properties.rateLimit();
        this.authWrite = new FixedWindowRateLimiter("auth-write", limits.write(), clock);
        this.authRead = new FixedWindowRateLimiter("auth-read", limits.read(), clock);
        this.stream = new FixedWindowRateLimiter("stream", limits.stream(), clock);
    }

    public FixedWindowRateLimiter authWrite() { return authWrite; }

    public FixedWindowRateLimiter authRead() { return authRead; }

    public FixedWindowRateLimiter stream() { return stream; }

    public List<FixedWindowRateLimiter> all() {
        return List.of(authWrite, authRead, stream);
    }
}
