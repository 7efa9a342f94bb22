package io.github.drompincen.webdeck.protocol.api;

import java.time.Instant;

public record DeviceDto(
        String id,
        String name,
        DeviceType type,
        DeviceStatus status,
        Instant createdAt,
        Instant lastActiveAt,
        Instant expiresAt,
        String ipAddress,
        String userAgent
) {}
