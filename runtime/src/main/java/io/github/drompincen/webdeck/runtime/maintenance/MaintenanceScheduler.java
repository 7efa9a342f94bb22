package io.github.drompincen.webdeck.runtime.maintenance;

import io.github.drompincen.webdeck.runtime.device.DeviceAuthorizationService;
import io.github.drompincen.webdeck.runtime.ratelimit.FixedWindowRateLimiter;
import io.github.drompincen.webdeck.runtime.ratelimit.RateLimiters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class MaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceScheduler.class);

    private final RateLimiters rateLimiters;
    private final DeviceAuthorizationService deviceAuthorizationService;

    public MaintenanceScheduler(RateLimiters rateLimiters, DeviceAuthorizationService deviceAuthorizationService) {
        this.rateLimiters = rateLimiters;
        this.deviceAuthorizationService = deviceAuthorizationService;
    }

    @Scheduled(fixedDelay = 60000)
    public void evictRateLimitWindows() {
        for (FixedWindowRateLimiter limiter : rateLimiters.all()) {
            int evicted = limiter.evictExpired();
            if (evicted > 0) {
                log.debug("Evicted {} expired windows from rate limiter {}", evicted, limiter.name());
            }
        }
    }

    @Scheduled(fixedDelay = 60000, initialDelay = 30000)
    public void expireStaleRegistrations() {
        try {
            deviceAuthorizationService.expireStaleRegistrations();
        } catch (Exception e) {
            log.error("Failed to expire stale device registrations", e);
        }
    }
}
