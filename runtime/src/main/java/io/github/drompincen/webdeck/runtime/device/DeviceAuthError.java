package io.github.drompincen.webdeck.runtime.device;

public enum DeviceAuthError {
    INVALID_CODE,
    EXPIRED,
    NOT_FOUND,
    UNAUTHORIZED
}
