package io.github.drompincen.webdeck.runtime.stream;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.webdeck.protocol.stream.StreamEvent;
import io.github.drompincen.webdeck.runtime.cancel.CancellationRegistry;
import io.github.drompincen.webdeck.runtime.cancel.CancellationToken;
import io.github.drompincen.webdeck.runtime.cancel.RequestConflictException;
import io.github.drompincen.webdeck.runtime.exec.ExecutionContext;
import io.github.drompincen.webdeck.runtime.exec.ExecutionFailureException;
import io.github.drompincen.webdeck.runtime.exec.ExecutorRegistry;
import io.github.drompincen.webdeck.runtime.exec.FailureKind;
import io.github.drompincen.webdeck.runtime.exec.StreamingExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Drives one streaming request from registration to its single terminal event.
 * Every started request ends with exactly one of {@code done}, {@code exit},
 * {@code aborted} or {@code error}, and its registry entry is released.
 */
@Service
public class RequestLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(RequestLifecycleManager.class);

    private final CancellationRegistry registry;
    private final ExecutorRegistry executors;

    public RequestLifecycleManager(CancellationRegistry registry, ExecutorRegistry executors) {
        this.registry = registry;
        this.executors = executors;
    }

    /**
     * Runs the request on the calling thread and returns its final state. Never throws;
     * every outcome is reported through {@code sink}.
     */
    public RequestState run(String requestId, String executorName, JsonNode params, StreamEventSink sink) {
        Optional<StreamingExecutor> executor = executors.get(executorName);
        if (executor.isEmpty()) {
            log.error("Request {}: no executor named {}", requestId, executorName);
            sink.accept(StreamEvent.error("No executor available for " + executorName));
            sink.close();
            return RequestState.FAILED;
        }

        CancellationToken token;
        try {
            token = registry.register(requestId);
        } catch (RequestConflictException e) {
            log.warn("Request {} rejected: {}", requestId, e.getMessage());
            sink.accept(StreamEvent.error(e.getMessage()));
            sink.close();
            return RequestState.FAILED;
        }

        TerminalEventGuard guard = new TerminalEventGuard(sink, token);
        long startedAt = System.currentTimeMillis();
        log.info("Request {} running on {}", requestId, executorName);
        try {
            sink.attach(token);
            executor.get().execute(new ExecutionContext(requestId, token, params), guard);
            if (!guard.hasTerminated()) {
                guard.accept(token.isCancelled() ? StreamEvent.aborted() : StreamEvent.done());
            }
        } catch (ExecutionFailureException e) {
            if (e.kind() == FailureKind.CANCELLED || token.isCancelled()) {
                guard.accept(StreamEvent.aborted());
            } else {
                log.warn("Request {} failed ({}): {}", requestId, e.kind(), e.getMessage());
                guard.accept(StreamEvent.error(e.getMessage()));
            }
        } catch (RuntimeException e) {
            if (token.isCancelled()) {
                log.debug("Request {} failed after cancellation: {}", requestId, e.getMessage());
                guard.accept(StreamEvent.aborted());
            } else {
                log.error("Request {} failed unexpectedly", requestId, e);
                guard.accept(StreamEvent.error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
            }
        } finally {
            registry.release(requestId);
            sink.close();
        }

        RequestState state = guard.outcome();
        log.info("Request {} finished {} in {} ms", requestId, state, System.currentTimeMillis() - startedAt);
        return state;
    }

    /**
     * @return false if no live request has this id
     */
    public boolean cancel(String requestId) {
        return registry.cancel(requestId);
    }

    public boolean isActive(String requestId) {
        return registry.isActive(requestId);
    }
}
