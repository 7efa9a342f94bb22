package io.github.drompincen.webdeck.protocol.api;

public record PathValidationRequest(String path) {}
