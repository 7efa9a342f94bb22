package io.github.drompincen.webdeck.protocol.api;

public record TerminalRequest(
        String command,
        String workingDirectory,
        String requestId,
        String shell
) {
    public TerminalRequest(String command, String requestId) {
        this(command, null, requestId, null);
    }
}
