package io.github.drompincen.webdeck.runtime.stream;

import io.github.drompincen.webdeck.protocol.stream.StreamEvent;
import io.github.drompincen.webdeck.runtime.cancel.CancellationToken;

/**
 * Destination of a request's events. Implementations must tolerate concurrent callers.
 */
public interface StreamEventSink {

    void accept(StreamEvent event);

    /** Called once the request owns {@code token}; a sink that detects a gone client cancels it. */
    default void attach(CancellationToken token) {}

    default void close() {}
}
