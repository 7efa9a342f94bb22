package io.github.drompincen.webdeck.runtime.stream;

public enum RequestState {
    CREATED,
    RUNNING,
    COMPLETED,
    CANCELLED,
    FAILED;

    public boolean isFinal() {
        return this == COMPLETED || this == CANCELLED || this == FAILED;
    }
}
