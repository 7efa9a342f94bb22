package io.github.drompincen.webdeck.runtime.device;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import io.github.drompincen.webdeck.runtime.config.WebDeckProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Optional;
import java.util.UUID;

/**
 * Issues and checks the HS256 bearer tokens handed to approved devices.
 */
@Service
public class DeviceTokenService {

    private static final Logger log = LoggerFactory.getLogger(DeviceTokenService.class);
    static final int MIN_SECRET_BYTES = 32;
    static final String DEVICE_ID_CLAIM = "deviceId";

    private final byte[] secret;
    private final Duration ttl;
    private final Clock clock;

    public DeviceTokenService(WebDeckProperties properties, Clock clock) {
        this.secret = resolveSecret(properties.auth().jwtSecret());
        this.ttl = properties.auth().tokenTtl();
        this.clock = clock;
    }

    public IssuedToken issue(String deviceId) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = now.plus(ttl);
        JWTClaimsSet claims = new JWTClaimsSet.Builder()
                .subject(deviceId)
                .claim(DEVICE_ID_CLAIM, deviceId)
                .issueTime(Date.from(now))
                .expirationTime(Date.from(expiresAt))
                .jwtID(UUID.randomUUID().toString())
                .build();
        SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims);
        try {
            jwt.sign(new MACSigner(secret));
        } catch (JOSEException e) {
            throw new IllegalStateException("Failed to sign device token", e);
        }
        return new IssuedToken(jwt.serialize(), expiresAt);
    }

    /**
     * Checks signature and expiry only; whether the device is still approved is the
     * caller's concern.
     *
     * @return the device id the token was issued to
     */
    public Optional<String> verify(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            SignedJWT jwt = SignedJWT.parse(token);
            if (!JWSAlgorithm.HS256.equals(jwt.getHeader().getAlgorithm())
                    || !jwt.verify(new MACVerifier(secret))) {
                log.warn("Rejected device token with bad signature");
                return Optional.empty();
            }
            JWTClaimsSet claims = jwt.getJWTClaimsSet();
            Date exp = claims.getExpirationTime();
            if (exp == null || !exp.toInstant().isAfter(clock.instant())) {
                log.debug("Rejected expired device token for {}", claims.getSubject());
                return Optional.empty();
            }
            String deviceId = claims.getStringClaim(DEVICE_ID_CLAIM);
            if (deviceId == null || !deviceId.equals(claims.getSubject())) {
                log.warn("Rejected device token with inconsistent subject");
                return Optional.empty();
            }
            return Optional.of(deviceId);
        } catch (ParseException | JOSEException e) {
            log.debug("Rejected malformed device token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static byte[] resolveSecret(String configured) {
        if (configured == null || configured.isBlank()) {
            byte[] generated = new byte[MIN_SECRET_BYTES];
            new SecureRandom().nextBytes(generated);
            log.warn("webdeck.auth.jwt-secret is not set; using a random secret, issued tokens will not survive a restart");
            return generated;
        }
        byte[] bytes = configured.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < MIN_SECRET_BYTES) {
            throw new IllegalArgumentException("webdeck.auth.jwt-secret must be at least "
                    + MIN_SECRET_BYTES + " bytes, got " + bytes.length);
        }
        return bytes;
    }
}
