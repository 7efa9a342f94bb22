package io.github.drompincen.webdeck.gateway.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.webdeck.runtime.stream.RequestLifecycleManager;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

/**
 * Turns a lifecycle run into an NDJSON HTTP response body.
 */
@Component
public class StreamingResponder {

    private final RequestLifecycleManager lifecycle;
    private final ObjectMapper objectMapper;

    public StreamingResponder(RequestLifecycleManager lifecycle, ObjectMapper objectMapper) {
        this.lifecycle = lifecycle;
        this.objectMapper = objectMapper;
    }

    public ResponseEntity<StreamingResponseBody> stream(String requestId, String executorName, Object request) {
        JsonNode params = objectMapper.valueToTree(request);
        StreamingResponseBody body = out ->
                lifecycle.run(requestId, executorName, params, new NdjsonStreamWriter(out, objectMapper, requestId));
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(NdjsonStreamWriter.CONTENT_TYPE))
                .header(HttpHeaders.CACHE_CONTROL, "no-cache")
                .body(body);
    }

    public boolean abort(String requestId) {
        return lifecycle.cancel(requestId);
    }
}
