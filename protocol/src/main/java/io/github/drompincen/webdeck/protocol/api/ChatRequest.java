package io.github.drompincen.webdeck.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ChatRequest(
        String message,
        String sessionId,
        String requestId,
        List<String> allowedTools,
        String workingDirectory,
        Thinking thinking
) {
    public ChatRequest(String message, String requestId) {
        this(message, null, requestId, null, null, null);
    }

    public record Thinking(String type, @JsonProperty("budget_tokens") int budgetTokens) {}
}
