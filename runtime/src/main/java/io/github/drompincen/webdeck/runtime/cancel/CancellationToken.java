package io.github.drompincen.webdeck.runtime.cancel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot cancellation signal owned by a single streaming request.
 */
public final class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private final String requestId;
    private final Instant createdAt;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Runnable> callbacks = new ArrayList<>();

    public CancellationToken(String requestId, Instant createdAt) {
        this.requestId = requestId;
        this.createdAt = createdAt;
    }

    public String requestId() { return requestId; }

    public Instant createdAt() { return createdAt; }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Signals cancellation and runs the registered callbacks.
     *
     * @return true only for the call that flipped the token
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        List<Runnable> pending;
        synchronized (callbacks) {
            pending = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        for (Runnable callback : pending) {
            runCallback(callback);
        }
        return true;
    }

    /**
     * Registers a callback run once on cancellation, immediately if the token is
     * already cancelled.
     */
    public void onCancel(Runnable callback) {
        synchronized (callbacks) {
            if (!cancelled.get()) {
                callbacks.add(callback);
                return;
            }
        }
        runCallback(callback);
    }

    private void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Cancel callback failed for request {}: {}", requestId, e.getMessage(), e);
        }
    }
}
