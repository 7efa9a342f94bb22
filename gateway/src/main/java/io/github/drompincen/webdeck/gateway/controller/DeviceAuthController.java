package io.github.drompincen.webdeck.gateway.controller;

import io.github.drompincen.webdeck.gateway.web.ClientAddress;
import io.github.drompincen.webdeck.protocol.api.AuthorizeDeviceRequest;
import io.github.drompincen.webdeck.protocol.api.DeviceListResponse;
import io.github.drompincen.webdeck.protocol.api.DeviceRegistration;
import io.github.drompincen.webdeck.protocol.api.RegisterDeviceRequest;
import io.github.drompincen.webdeck.protocol.api.VerificationResult;
import io.github.drompincen.webdeck.protocol.api.VerifyDeviceRequest;
import io.github.drompincen.webdeck.runtime.device.DeviceAuthError;
import io.github.drompincen.webdeck.runtime.device.DeviceAuthException;
import io.github.drompincen.webdeck.runtime.device.DeviceAuthorizationService;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Device pairing: a remote device registers and shows its code, the operator approves
 * or rejects it from a trusted session, and the device's verify call completes with a
 * token once that decision lands.
 */
@RestController
@RequestMapping("/api/auth")
public class DeviceAuthController {

    private final DeviceAuthorizationService deviceAuthorizationService;
    private final ClientAddress clientAddress;

    public DeviceAuthController(DeviceAuthorizationService deviceAuthorizationService, ClientAddress clientAddress) {
        this.deviceAuthorizationService = deviceAuthorizationService;
        this.clientAddress = clientAddress;
    }

    @PostMapping("/register")
    public DeviceRegistration register(@RequestBody RegisterDeviceRequest request, HttpServletRequest http) {
        return deviceAuthorizationService.register(request, clientAddress.of(http));
    }

    /** Held open until the operator decides or the wait times out. */
    @PostMapping("/verify")
    public CompletableFuture<VerificationResult> verify(@RequestBody VerifyDeviceRequest request) {
        return deviceAuthorizationService.verify(request.deviceId(), request.verificationCode());
    }

    @PostMapping("/authorize")
    public ResponseEntity<Map<String, Object>> authorize(@RequestBody AuthorizeDeviceRequest request) {
        if (deviceAuthorizationService.authorize(request.deviceId(), request.action())) {
            return ResponseEntity.ok(Map.of("resolved", true));
        }
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Map.of("resolved", false, "error", "No pending authorization for this device"));
    }

    @GetMapping("/devices")
    public DeviceListResponse devices() {
        return new DeviceListResponse(deviceAuthorizationService.listDevices());
    }

    @DeleteMapping("/devices/{deviceId}")
    public Map<String, Object> revoke(@PathVariable String deviceId) {
        if (!deviceAuthorizationService.revoke(deviceId)) {
            throw new DeviceAuthException(DeviceAuthError.NOT_FOUND, "Device not found");
        }
        return Map.of("success", true);
    }
}
