package io.github.drompincen.webdeck.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SystemInfoDto(
        String username,
        String hostname,
        String platform,
        String homeDirectory,
        String currentWorkingDirectory,
        @JsonProperty("isWSL") boolean wsl
) {}
