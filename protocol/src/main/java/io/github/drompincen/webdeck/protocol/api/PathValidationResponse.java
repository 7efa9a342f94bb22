package io.github.drompincen.webdeck.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PathValidationResponse(
        @JsonProperty("isValid") boolean valid,
        String message
) {
    public static PathValidationResponse valid(String message) {
        return new PathValidationResponse(true, message);
    }

    public static PathValidationResponse invalid(String message) {
        return new PathValidationResponse(false, message);
    }
}
