package io.github.drompincen.webdeck.gateway.web;

import io.github.drompincen.webdeck.runtime.config.WebDeckProperties;
import io.github.drompincen.webdeck.runtime.device.DeviceAuthError;
import io.github.drompincen.webdeck.runtime.device.DeviceAuthException;
import io.github.drompincen.webdeck.runtime.device.DeviceAuthorizationService;
import jakarta.servlet.DispatcherType;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Requires a device bearer token on API calls. Requests from this machine pass without
 * one when {@code webdeck.auth.allow-localhost} is on.
 */
@Component
public class BearerTokenInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(BearerTokenInterceptor.class);
    public static final String DEVICE_ID_ATTRIBUTE = "webdeck.deviceId";
    private static final String BEARER_PREFIX = "Bearer ";

    private final DeviceAuthorizationService deviceAuthorizationService;
    private final boolean allowLocalhost;

    public BearerTokenInterceptor(DeviceAuthorizationService deviceAuthorizationService, WebDeckProperties properties) {
        this.deviceAuthorizationService = deviceAuthorizationService;
        this.allowLocalhost = properties.auth().allowLocalhost();
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        // async re-dispatches were checked on the way in
        if (request.getDispatcherType() == DispatcherType.ASYNC
                || "OPTIONS".equalsIgnoreCase(request.getMethod())) {
            return true;
        }
        if (allowLocalhost && ClientAddress.isLoopback(request)) {
            return true;
        }
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.startsWith(BEARER_PREFIX)) {
            throw new DeviceAuthException(DeviceAuthError.UNAUTHORIZED, "Authentication required");
        }
        String token = header.substring(BEARER_PREFIX.length()).trim();
        String deviceId = deviceAuthorizationService.validateToken(token).orElseThrow(() -> {
            log.warn("Rejected bearer token from {} for {}", request.getRemoteAddr(), request.getRequestURI());
            return new DeviceAuthException(DeviceAuthError.UNAUTHORIZED, "Invalid or expired token");
        });
        request.setAttribute(DEVICE_ID_ATTRIBUTE, deviceId);
        return true;
    }
}
