package io.github.drompincen.webdeck.gateway.controller;

import io.github.drompincen.webdeck.gateway.stream.StreamingResponder;
import io.github.drompincen.webdeck.protocol.api.PathValidationRequest;
import io.github.drompincen.webdeck.protocol.api.PathValidationResponse;
import io.github.drompincen.webdeck.protocol.api.ShellsResponse;
import io.github.drompincen.webdeck.protocol.api.SystemInfoDto;
import io.github.drompincen.webdeck.protocol.api.TerminalRequest;
import io.github.drompincen.webdeck.tools.SystemInfoProbe;
import io.github.drompincen.webdeck.tools.WorkingDirectoryResolver;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/terminal")
public class TerminalController {

    static final String SHELL_EXECUTOR = "shell";

    private final StreamingResponder responder;
    private final SystemInfoProbe systemInfoProbe;
    private final WorkingDirectoryResolver workingDirectoryResolver;

    public TerminalController(StreamingResponder responder, SystemInfoProbe systemInfoProbe,
                              WorkingDirectoryResolver workingDirectoryResolver) {
        this.responder = responder;
        this.systemInfoProbe = systemInfoProbe;
        this.workingDirectoryResolver = workingDirectoryResolver;
    }

    @PostMapping("/execute")
    public ResponseEntity<?> execute(@RequestBody TerminalRequest request) {
        if (request.command() == null || request.command().isBlank()
                || request.requestId() == null || request.requestId().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Command and requestId are required"));
        }
        return responder.stream(request.requestId(), SHELL_EXECUTOR, request);
    }

    @PostMapping("/abort/{requestId}")
    public ResponseEntity<Map<String, Object>> abort(@PathVariable String requestId) {
        if (responder.abort(requestId)) {
            return ResponseEntity.ok(Map.of("success", true, "message", "Terminal command aborted"));
        }
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Map.of("error", "Terminal request not found or already completed"));
    }

    @GetMapping("/shells")
    public ShellsResponse shells() {
        return systemInfoProbe.shells();
    }

    @GetMapping("/info")
    public SystemInfoDto info() {
        return systemInfoProbe.systemInfo();
    }

    @PostMapping("/validate-path")
    public ResponseEntity<?> validatePath(@RequestBody PathValidationRequest request) {
        if (request.path() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "Path is required"));
        }
        PathValidationResponse result = workingDirectoryResolver.validate(request.path());
        return ResponseEntity.ok(result);
    }
}
