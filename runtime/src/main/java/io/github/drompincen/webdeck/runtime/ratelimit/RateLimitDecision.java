package io.github.drompincen.webdeck.runtime.ratelimit;

/**
 * @param retryAfterSeconds seconds until the window resets; 0 when allowed
 */
public record RateLimitDecision(boolean allowed, int remaining, long retryAfterSeconds) {

    static RateLimitDecision allow(int remaining) {
        return new RateLimitDecision(true, remaining, 0);
    }

    static RateLimitDecision deny(long retryAfterSeconds) {
        return new RateLimitDecision(false, 0, retryAfterSeconds);
    }
}
