package io.github.drompincen.webdeck.gateway.web;

import io.github.drompincen.webdeck.runtime.config.WebDeckProperties;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Identifies the caller for rate limiting and device records. Forwarding headers are
 * honoured only when {@code webdeck.rate-limit.trust-forwarded-headers} is on, since any
 * client can send them.
 */
@Component
public class ClientAddress {

    private static final Logger log = LoggerFactory.getLogger(ClientAddress.class);

    private final boolean trustForwardedHeaders;

    public ClientAddress(WebDeckProperties properties) {
        this.trustForwardedHeaders = properties.rateLimit().trustForwardedHeaders();
    }

    /** The socket peer, or the first {@code X-Forwarded-For} hop then {@code X-Real-IP} when trusted. */
    public String of(HttpServletRequest request) {
        if (trustForwardedHeaders) {
            String forwarded = request.getHeader("X-Forwarded-For");
            if (forwarded != null && !forwarded.isBlank()) {
                return forwarded.split(",")[0].trim();
            }
            String realIp = request.getHeader("X-Real-IP");
            if (realIp != null && !realIp.isBlank()) {
                return realIp.trim();
            }
        }
        return request.getRemoteAddr();
    }

    /** Whether the socket peer, not any forwarded header, is this machine. */
    public static boolean isLoopback(HttpServletRequest request) {
        String remote = request.getRemoteAddr();
        if (remote == null || remote.isBlank()) {
            return false;
        }
        try {
            return InetAddress.getByName(remote).isLoopbackAddress();
        } catch (UnknownHostException e) {
            log.debug("Unparseable remote address {}: {}", remote, e.getMessage());
            return false;
        }
    }
}
