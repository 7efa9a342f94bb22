package io.github.drompincen.webdeck.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum DeviceType {
    @JsonProperty("mobile") MOBILE,
    @JsonProperty("tablet") TABLET,
    @JsonProperty("desktop") DESKTOP
}
