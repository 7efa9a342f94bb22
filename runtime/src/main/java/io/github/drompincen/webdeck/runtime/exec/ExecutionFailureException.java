package io.github.drompincen.webdeck.runtime.exec;

public class ExecutionFailureException extends RuntimeException {

    private final FailureKind kind;

    public ExecutionFailureException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ExecutionFailureException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static ExecutionFailureException cancelled() {
        return new ExecutionFailureException(FailureKind.CANCELLED, "Request was cancelled");
    }

    public FailureKind kind() { return kind; }
}
