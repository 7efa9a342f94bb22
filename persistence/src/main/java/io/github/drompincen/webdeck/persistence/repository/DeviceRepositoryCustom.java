package io.github.drompincen.webdeck.persistence.repository;

import io.github.drompincen.webdeck.persistence.document.DeviceDocument;
import io.github.drompincen.webdeck.protocol.api.DeviceStatus;

import java.time.Instant;
import java.util.Optional;

/**
 * Conditional single-document updates. Each method is one atomic MongoDB operation
 * whose filter encodes the state the caller expects, so racing writers on the same
 * device cannot overwrite each other's transitions.
 */
public interface DeviceRepositoryCustom {

    /**
     * Clears the verification code of a pending device and returns the document as it
     * was before the update. Empty if the device is unknown, not pending, or its code
     * was already consumed.
     */
    Optional<DeviceDocument> consumeVerificationCode(String deviceId);

    /** PENDING → APPROVED with the issued token. False if the device left PENDING meanwhile. */
    boolean approve(String deviceId, String authToken, Instant tokenExpiresAt, Instant now);

    /** PENDING → {@code status}. False if the device was not pending. */
    boolean resolvePending(String deviceId, DeviceStatus status);

    /**
     * Refreshes {@code lastActiveAt} only when the device is APPROVED, still holds exactly
     * this token and the token has not expired.
     */
    boolean touchIfActive(String deviceId, String authToken, Instant now);

    /** Clears the token and code and forces REJECTED. False if the device is unknown. */
    boolean revoke(String deviceId);

    /** Moves pending registrations whose window closed before {@code now} to EXPIRED. */
    long expireStalePending(Instant now);
}
