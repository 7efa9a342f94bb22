package io.github.drompincen.webdeck.protocol.api;

import java.time.Instant;

/**
 * Outcome of a verification wait. {@code authToken} and {@code expiresAt} are only set
 * when {@code status} is {@link DeviceStatus#APPROVED}.
 */
public record VerificationResult(
        String deviceId,
        DeviceStatus status,
        String authToken,
        Instant expiresAt
) {
    public static VerificationResult approved(String deviceId, String authToken, Instant expiresAt) {
        return new VerificationResult(deviceId, DeviceStatus.APPROVED, authToken, expiresAt);
    }

    public static VerificationResult denied(String deviceId, DeviceStatus status) {
        return new VerificationResult(deviceId, status, null, null);
    }
}
