package io.github.drompincen.webdeck.runtime.stream;

import io.github.drompincen.webdeck.protocol.stream.StreamEvent;
import io.github.drompincen.webdeck.protocol.stream.StreamEventType;
import io.github.drompincen.webdeck.runtime.cancel.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lets exactly one terminal event through to the wrapped sink. Once the token is
 * cancelled, data is dropped and any terminal event is reported as {@code aborted}.
 */
final class TerminalEventGuard implements StreamEventSink {

    private static final Logger log = LoggerFactory.getLogger(TerminalEventGuard.class);

    private final StreamEventSink delegate;
    private final CancellationToken token;
    private StreamEvent terminal;

    TerminalEventGuard(StreamEventSink delegate, CancellationToken token) {
        this.delegate = delegate;
        this.token = token;
    }

    @Override
    public synchronized void accept(StreamEvent event) {
        if (terminal != null) {
            log.trace("Request {}: dropped {} after {}", token.requestId(), event.wireType(), terminal.wireType());
            return;
        }
        if (event.type() == StreamEventType.DATA && token.isCancelled()) {
            return;
        }
        if (event.isTerminal()) {
            if (token.isCancelled() && event.type() != StreamEventType.ABORTED) {
                event = StreamEvent.aborted();
            }
            terminal = event;
        }
        delegate.accept(event);
    }

    synchronized boolean hasTerminated() {
        return terminal != null;
    }

    synchronized RequestState outcome() {
        if (terminal == null) {
            return RequestState.RUNNING;
        }
        switch (terminal.type()) {
            case DONE:
            case EXIT:
                return RequestState.COMPLETED;
            case ABORTED:
                return RequestState.CANCELLED;
            default:
                return RequestState.FAILED;
        }
    }
}
