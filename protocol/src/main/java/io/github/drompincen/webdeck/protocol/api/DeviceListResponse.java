package io.github.drompincen.webdeck.protocol.api;

import java.util.List;

public record DeviceListResponse(List<DeviceDto> devices) {}
