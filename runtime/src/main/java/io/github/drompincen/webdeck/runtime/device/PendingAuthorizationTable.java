package io.github.drompincen.webdeck.runtime.device;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Verification waits keyed by device id. Each slot races an operator decision against
 * a timer; the first resolution removes the slot and the other side becomes a no-op.
 */
@Component
public class PendingAuthorizationTable {

    private static final Logger log = LoggerFactory.getLogger(PendingAuthorizationTable.class);

    private final Map<String, PendingAuthorization> slots = new ConcurrentHashMap<>();
    private final TaskScheduler scheduler;
    private final Clock clock;

    public PendingAuthorizationTable(TaskScheduler scheduler, Clock clock) {
        this.scheduler = scheduler;
        this.clock = clock;
    }

    /**
     * Opens the wait for {@code deviceId}. The returned future completes with
     * {@link AuthorizationDecision#TIMED_OUT} if nobody resolves it within {@code timeout}.
     */
    public CompletableFuture<AuthorizationDecision> open(String deviceId, Duration timeout) {
        Instant now = clock.instant();
        PendingAuthorization slot = new PendingAuthorization(deviceId, now);
        if (slots.putIfAbsent(deviceId, slot) != null) {
            throw new IllegalStateException("Device " + deviceId + " already has a pending authorization");
        }
        slot.attachTimer(scheduler.schedule(() -> expire(slot), now.plus(timeout)));
        log.debug("Opened authorization wait for device {} ({})", deviceId, timeout);
        return slot.decision().copy();
    }

    /**
     * @return true if a pending slot existed and this call resolved it
     */
    public boolean resolve(String deviceId, AuthorizationDecision decision) {
        PendingAuthorization slot = slots.remove(deviceId);
        if (slot == null) {
            return false;
        }
        boolean resolved = slot.resolve(decision);
        if (resolved) {
            log.debug("Authorization wait for device {} resolved {}", deviceId, decision);
        }
        return resolved;
    }

    public boolean isPending(String deviceId) {
        return slots.containsKey(deviceId);
    }

    public int size() {
        return slots.size();
    }

    private void expire(PendingAuthorization slot) {
        if (slots.remove(slot.deviceId(), slot) && slot.resolve(AuthorizationDecision.TIMED_OUT)) {
            log.info("Authorization wait for device {} timed out", slot.deviceId());
        }
    }
}
