package io.github.drompincen.webdeck.runtime.device;

import io.github.drompincen.webdeck.persistence.document.DeviceDocument;
import io.github.drompincen.webdeck.persistence.repository.DeviceRepository;
import io.github.drompincen.webdeck.protocol.api.*;
import io.github.drompincen.webdeck.runtime.config.WebDeckProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Device pairing: a device registers, proves it holds the code shown to the operator,
 * then waits until the operator approves or rejects it or the wait times out.
 * Approved devices receive a bearer token that stays valid until it expires or the
 * device is revoked.
 */
@Service
public class DeviceAuthorizationService {

    private static final Logger log = LoggerFactory.getLogger(DeviceAuthorizationService.class);
    private static final int MAX_NAME_LENGTH = 100;

    private final DeviceRepository deviceRepository;
    private final PendingAuthorizationTable pending;
    private final DeviceTokenService tokenService;
    private final VerificationCodeGenerator codeGenerator;
    private final WebDeckProperties.Auth settings;
    private final Clock clock;

    public DeviceAuthorizationService(DeviceRepository deviceRepository,
                                      PendingAuthorizationTable pending,
                                      DeviceTokenService tokenService,
                                      VerificationCodeGenerator codeGenerator,
                                      WebDeckProperties properties,
                                      Clock clock) {
        this.deviceRepository = deviceRepository;
        this.pending = pending;
        this.tokenService = tokenService;
        this.codeGenerator = codeGenerator;
        this.settings = properties.auth();
        this.clock = clock;
    }

    public DeviceRegistration register(RegisterDeviceRequest request, String clientAddress) {
        if (request == null || request.deviceName() == null || request.deviceName().isBlank()) {
            throw new IllegalArgumentException("deviceName is required");
        }
        String name = request.deviceName().strip();
        if (name.length() > MAX_NAME_LENGTH) {
            name = name.substring(0, MAX_NAME_LENGTH);
        }
        Instant now = clock.instant();

        DeviceDocument doc = new DeviceDocument();
        doc.setDeviceId(UUID.randomUUID().toString());
        doc.setName(name);
        doc.setType(request.deviceType() != null ? request.deviceType() : DeviceType.DESKTOP);
        doc.setStatus(DeviceStatus.PENDING);
        doc.setVerificationCode(codeGenerator.next());
        doc.setCodeExpiresAt(now.plus(settings.codeTtl()));
        doc.setCreatedAt(now);
        doc.setExpiresAt(now.plus(settings.registrationTtl()));
        doc.setIpAddress(clientAddress);
        doc.setUserAgent(request.userAgent());
        deviceRepository.save(doc);

        log.info("Registered device {} ({}, {}) from {}", doc.getDeviceId(), name, doc.getType(), clientAddress);
        return new DeviceRegistration(doc.getDeviceId(), doc.getVerificationCode(), doc.getStatus(), doc.getExpiresAt());
    }

    /**
     * Consumes the verification code and opens the authorization wait. Any attempt,
     * right or wrong, uses the code up.
     *
     * @throws DeviceAuthException INVALID_CODE for a wrong, used or expired code,
     *                             EXPIRED when the registration itself has lapsed
     */
    public CompletableFuture<VerificationResult> verify(String deviceId, String code) {
        if (deviceId == null || code == null) {
            throw new IllegalArgumentException("deviceId and verificationCode are required");
        }
        Instant now = clock.instant();
        DeviceDocument before = deviceRepository.consumeVerificationCode(deviceId)
                .orElseThrow(() -> new DeviceAuthException(DeviceAuthError.INVALID_CODE,
                        "Invalid or already used verification code"));

        if (before.getExpiresAt() != null && !before.getExpiresAt().isAfter(now)) {
            deviceRepository.resolvePending(deviceId, DeviceStatus.EXPIRED);
            log.info("Verification for device {} arrived after its registration expired", deviceId);
            throw new DeviceAuthException(DeviceAuthError.EXPIRED, "Device registration has expired");
        }
        if (!codesMatch(before.getVerificationCode(), code)
                || before.getCodeExpiresAt() == null || !before.getCodeExpiresAt().isAfter(now)) {
            log.warn("Invalid verification code for device {}", deviceId);
            throw new DeviceAuthException(DeviceAuthError.INVALID_CODE, "Invalid or expired verification code");
        }

        log.info("Device {} verified, waiting up to {} for authorization", deviceId, settings.verifyTimeout());
        return pending.open(deviceId, settings.verifyTimeout())
                .thenApply(decision -> complete(deviceId, decision));
    }

    /**
     * @return true if a device was waiting and this call decided it
     */
    public boolean authorize(String deviceId, AuthorizationAction action) {
        if (deviceId == null || action == null) {
            throw new IllegalArgumentException("deviceId and action are required");
        }
        AuthorizationDecision decision = action == AuthorizationAction.APPROVE
                ? AuthorizationDecision.APPROVED : AuthorizationDecision.REJECTED;
        boolean resolved = pending.resolve(deviceId, decision);
        if (resolved) {
            log.info("Operator {} device {}", decision == AuthorizationDecision.APPROVED ? "approved" : "rejected", deviceId);
        } else {
            log.info("No pending authorization for device {}", deviceId);
        }
        return resolved;
    }

    /**
     * @return the device id when the token is genuine, unexpired and still held by an
     *         approved device; records the device as active
     */
    public Optional<String> validateToken(String token) {
        Optional<String> deviceId = tokenService.verify(token)
                .filter(id -> deviceRepository.touchIfActive(id, token, clock.instant()));
        if (deviceId.isEmpty()) {
            log.debug("Bearer token rejected");
        }
        return deviceId;
    }

    public boolean revoke(String deviceId) {
        boolean found = deviceRepository.revoke(deviceId);
        pending.resolve(deviceId, AuthorizationDecision.REJECTED);
        if (found) {
            log.info("Revoked device {}", deviceId);
        }
        return found;
    }

    public List<DeviceDto> listDevices() {
        return deviceRepository.findAllByOrderByCreatedAtDesc().stream()
                .map(DeviceAuthorizationService::toDto)
                .collect(Collectors.toList());
    }

    /** Moves pending registrations whose window has passed to EXPIRED. */
    public long expireStaleRegistrations() {
        long expired = deviceRepository.expireStalePending(clock.instant());
        if (expired > 0) {
            log.info("Expired {} stale device registrations", expired);
        }
        return expired;
    }

    private VerificationResult complete(String deviceId, AuthorizationDecision decision) {
        switch (decision) {
            case APPROVED: {
                IssuedToken token = tokenService.issue(deviceId);
                if (deviceRepository.approve(deviceId, token.token(), token.expiresAt(), clock.instant())) {
                    log.info("Issued token for device {} valid until {}", deviceId, token.expiresAt());
                    return VerificationResult.approved(deviceId, token.token(), token.expiresAt());
                }
                log.warn("Device {} left the pending state before approval; token discarded", deviceId);
                return VerificationResult.denied(deviceId, currentStatus(deviceId));
            }
            case REJECTED:
                deviceRepository.resolvePending(deviceId, DeviceStatus.REJECTED);
                return VerificationResult.denied(deviceId, DeviceStatus.REJECTED);
            default:
                deviceRepository.resolvePending(deviceId, DeviceStatus.EXPIRED);
                return VerificationResult.denied(deviceId, DeviceStatus.EXPIRED);
        }
    }

    private DeviceStatus currentStatus(String deviceId) {
        return deviceRepository.findById(deviceId)
                .map(DeviceDocument::getStatus)
                .orElse(DeviceStatus.REJECTED);
    }

    private static boolean codesMatch(String expected, String supplied) {
        if (expected == null || supplied == null) {
            return false;
        }
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
                supplied.strip().getBytes(StandardCharsets.UTF_8));
    }

    static DeviceDto toDto(DeviceDocument doc) {
        return new DeviceDto(doc.getDeviceId(), doc.getName(), doc.getType(), doc.getStatus(),
                doc.getCreatedAt(), doc.getLastActiveAt(), doc.getExpiresAt(),
                doc.getIpAddress(), doc.getUserAgent());
    }
}
