package io.github.drompincen.webdeck.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum AuthorizationAction {
    @JsonProperty("approve") APPROVE,
    @JsonProperty("reject") REJECT
}
