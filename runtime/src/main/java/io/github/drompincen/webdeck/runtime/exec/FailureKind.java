package io.github.drompincen.webdeck.runtime.exec;

public enum FailureKind {
    /** The process could not be started. */
    LAUNCH,
    /** The process started and then failed. */
    RUNTIME,
    CANCELLED,
    /** Failure attributable to local setup: missing key, bad credentials, quota. */
    CONFIGURATION
}
