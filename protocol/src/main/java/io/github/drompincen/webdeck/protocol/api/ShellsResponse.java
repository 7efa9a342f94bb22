package io.github.drompincen.webdeck.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ShellsResponse(
        List<String> shells,
        String platform,
        @JsonProperty("default") String defaultShell
) {}
