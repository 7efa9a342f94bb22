package io.github.drompincen.webdeck.gateway.controller;

import io.github.drompincen.webdeck.gateway.stream.StreamingResponder;
import io.github.drompincen.webdeck.protocol.api.ChatRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api")
public class ChatController {

    static final String ASSISTANT_EXECUTOR = "assistant";

    private final StreamingResponder responder;

    public ChatController(StreamingResponder responder) {
        this.responder = responder;
    }

    @PostMapping("/chat")
    public ResponseEntity<?> chat(@RequestBody ChatRequest request) {
        if (request.message() == null || request.message().isBlank()
                || request.requestId() == null || request.requestId().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Message and requestId are required"));
        }
        return responder.stream(request.requestId(), ASSISTANT_EXECUTOR, request);
    }

    @PostMapping("/abort/{requestId}")
    public ResponseEntity<Map<String, Object>> abort(@PathVariable String requestId) {
        if (responder.abort(requestId)) {
            return ResponseEntity.ok(Map.of("success", true, "message", "Request aborted"));
        }
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Map.of("error", "Request not found or already completed"));
    }
}
