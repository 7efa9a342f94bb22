package io.github.drompincen.webdeck.gateway.web;

import io.github.drompincen.webdeck.runtime.ratelimit.FixedWindowRateLimiter;
import jakarta.servlet.DispatcherType;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Applies one limiter to the paths it is registered for, keyed by client address.
 * Denials surface as {@link io.github.drompincen.webdeck.runtime.ratelimit.RateLimitedException}.
 */
public class RateLimitInterceptor implements HandlerInterceptor {

    private final FixedWindowRateLimiter limiter;
    private final ClientAddress clientAddress;

    public RateLimitInterceptor(FixedWindowRateLimiter limiter, ClientAddress clientAddress) {
        this.limiter = limiter;
        this.clientAddress = clientAddress;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        // async re-dispatches were checked on the way in
        if (request.getDispatcherType() == DispatcherType.ASYNC
                || "OPTIONS".equalsIgnoreCase(request.getMethod())) {
            return true;
        }
        limiter.acquire(clientAddress.of(request));
        return true;
    }
}
