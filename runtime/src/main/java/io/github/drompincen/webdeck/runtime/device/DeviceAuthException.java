package io.github.drompincen.webdeck.runtime.device;

public class DeviceAuthException extends RuntimeException {

    private final DeviceAuthError error;

    public DeviceAuthException(DeviceAuthError error, String message) {
        super(message);
        this.error = error;
    }

    public DeviceAuthError getError() { return error; }
}
