package io.github.drompincen.webdeck.runtime.device;

import java.time.Instant;

public record IssuedToken(String token, Instant expiresAt) {}
