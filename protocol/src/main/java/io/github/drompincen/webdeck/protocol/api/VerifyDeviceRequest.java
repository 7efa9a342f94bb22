package io.github.drompincen.webdeck.protocol.api;

public record VerifyDeviceRequest(String deviceId, String verificationCode) {}
