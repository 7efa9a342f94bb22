package io.github.drompincen.webdeck.runtime.cancel;

public class RequestConflictException extends RuntimeException {

    private final String requestId;

    public RequestConflictException(String requestId) {
        super("Request " + requestId + " is already running");
        this.requestId = requestId;
    }

    public String getRequestId() { return requestId; }
}
