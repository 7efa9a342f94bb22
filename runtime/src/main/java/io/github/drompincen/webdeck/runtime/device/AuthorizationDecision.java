package io.github.drompincen.webdeck.runtime.device;

public enum AuthorizationDecision {
    APPROVED,
    REJECTED,
    TIMED_OUT
}
