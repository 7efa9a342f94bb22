package io.github.drompincen.webdeck.runtime.device;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * A verified device waiting for the operator. Completed once, by whichever of
 * authorize, revoke or the timer gets there first.
 */
final class PendingAuthorization {

    private final String deviceId;
    private final Instant openedAt;
    private final CompletableFuture<AuthorizationDecision> decision = new CompletableFuture<>();
    private volatile ScheduledFuture<?> timer;

    PendingAuthorization(String deviceId, Instant openedAt) {
        this.deviceId = deviceId;
        this.openedAt = openedAt;
    }

    String deviceId() { return deviceId; }

    Instant openedAt() { return openedAt; }

    CompletableFuture<AuthorizationDecision> decision() { return decision; }

    void attachTimer(ScheduledFuture<?> timer) {
        this.timer = timer;
        if (decision.isDone() && timer != null) {
            timer.cancel(false);
        }
    }

    boolean resolve(AuthorizationDecision outcome) {
        if (!decision.complete(outcome)) {
            return false;
        }
        ScheduledFuture<?> t = timer;
        if (t != null) {
            t.cancel(false);
        }
        return true;
    }
}
