package io.github.drompincen.webdeck.protocol.api;

public record RegisterDeviceRequest(
        String deviceName,
        DeviceType deviceType,
        String userAgent
) {}
