package io.github.drompincen.webdeck.runtime.exec;

import io.github.drompincen.webdeck.runtime.stream.StreamEventSink;

/**
 * A long-running unit of work whose output is streamed as events. Implementations are
 * discovered through {@link java.util.ServiceLoader}.
 */
public interface StreamingExecutor {

    String name();

    /**
     * Runs to completion on the calling thread. Returns normally after emitting its
     * terminal event, or throws {@link ExecutionFailureException}. Must observe
     * {@code context.token()} and stop promptly once it is cancelled.
     */
    void execute(ExecutionContext context, StreamEventSink sink);
}
