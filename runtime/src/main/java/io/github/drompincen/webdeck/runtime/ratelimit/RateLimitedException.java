package io.github.drompincen.webdeck.runtime.ratelimit;

public class RateLimitedException extends RuntimeException {

    private final long retryAfterSeconds;

    public RateLimitedException(String limiter, long retryAfterSeconds) {
        super("Too many requests, retry in " + retryAfterSeconds + "s (" + limiter + ")");
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public long getRetryAfterSeconds() { return retryAfterSeconds; }
}
