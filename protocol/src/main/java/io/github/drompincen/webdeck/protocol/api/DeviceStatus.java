package io.github.drompincen.webdeck.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Lifecycle of a registered device. {@code PENDING} is the only non-final state;
 * an approved device can still be forced to {@code REJECTED} by revocation.
 */
public enum DeviceStatus {
    @JsonProperty("pending") PENDING,
    @JsonProperty("approved") APPROVED,
    @JsonProperty("rejected") REJECTED,
    @JsonProperty("expired") EXPIRED
}
