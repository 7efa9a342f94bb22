package io.github.drompincen.webdeck.runtime.cancel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live streaming requests keyed by the client-chosen request id.
 */
@Component
public class CancellationRegistry {

    private static final Logger log = LoggerFactory.getLogger(CancellationRegistry.class);

    private final Map<String, CancellationToken> tokens = new ConcurrentHashMap<>();

    /**
     * @throws RequestConflictException if a request with the same id is still live
     */
    public CancellationToken register(String requestId) {
        CancellationToken token = new CancellationToken(requestId, Instant.now());
        CancellationToken existing = tokens.putIfAbsent(requestId, token);
        if (existing != null) {
            throw new RequestConflictException(requestId);
        }
        log.debug("Registered request {}", requestId);
        return token;
    }

    /**
     * @return false if no live request has this id
     */
    public boolean cancel(String requestId) {
        CancellationToken token = tokens.get(requestId);
        if (token == null) {
            return false;
        }
        if (token.cancel()) {
            log.info("Cancelled request {}", requestId);
        }
        return true;
    }

    public void release(String requestId) {
        if (tokens.remove(requestId) != null) {
            log.debug("Released request {}", requestId);
        }
    }

    public boolean isActive(String requestId) {
        return tokens.containsKey(requestId);
    }

    public Set<String> activeRequestIds() {
        return Set.copyOf(tokens.keySet());
    }
}
