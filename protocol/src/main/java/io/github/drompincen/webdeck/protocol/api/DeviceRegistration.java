package io.github.drompincen.webdeck.protocol.api;

import java.time.Instant;

public record DeviceRegistration(
        String deviceId,
        String verificationCode,
        DeviceStatus status,
        Instant expiresAt
) {}
