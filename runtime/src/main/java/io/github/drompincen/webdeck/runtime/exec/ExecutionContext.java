package io.github.drompincen.webdeck.runtime.exec;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.webdeck.runtime.cancel.CancellationToken;

public record ExecutionContext(
        String requestId,
        CancellationToken token,
        JsonNode params
) {
    public String text(String field) {
        JsonNode node = params == null ? null : params.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    public boolean isCancelled() {
        return token.isCancelled();
    }
}
