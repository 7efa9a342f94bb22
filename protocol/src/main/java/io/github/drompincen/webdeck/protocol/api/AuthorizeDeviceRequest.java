package io.github.drompincen.webdeck.protocol.api;

public record AuthorizeDeviceRequest(String deviceId, AuthorizationAction action) {}
