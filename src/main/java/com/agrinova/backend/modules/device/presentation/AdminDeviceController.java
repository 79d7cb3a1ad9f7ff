package com.agrinova.backend.modules.device.presentation;

import java.util.UUID;

import com.agrinova.backend.global.security.AuthenticatedPrincipal;
import com.agrinova.backend.modules.device.application.DeviceAdminService;
import com.agrinova.backend.modules.device.presentation.dto.DeviceBindingListResponse;
import com.agrinova.backend.modules.device.presentation.dto.DeviceBindingResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/users/{userId}/devices")
@PreAuthorize("hasAuthority('device:manage')")
@Tag(name = "Device administration")
public class AdminDeviceController {

    private final DeviceAdminService deviceAdminService;

    public AdminDeviceController(DeviceAdminService deviceAdminService) {
        this.deviceAdminService = deviceAdminService;
    }

    @GetMapping
    public ResponseEntity<DeviceBindingListResponse> list(
            @PathVariable UUID userId,
            @AuthenticationPrincipal AuthenticatedPrincipal principal
    ) {
        return ResponseEntity.ok(new DeviceBindingListResponse(deviceAdminService.listActive(userId, principal.userId())
                .stream().map(DeviceBindingResponse::from).toList()));
    }

    @Operation(summary = "Revoke device", description = "Tokens bound to the device are rejected from the next call on.")
    @PostMapping("/{deviceId}/revoke")
    public ResponseEntity<DeviceBindingResponse> revoke(
            @PathVariable UUID userId,
            @PathVariable String deviceId,
            @AuthenticationPrincipal AuthenticatedPrincipal principal
    ) {
        return ResponseEntity.ok(DeviceBindingResponse.from(
                deviceAdminService.revoke(userId, deviceId, principal.userId())));
    }

    @Operation(summary = "Unbind device", description = "Deletes the binding so the device can register again.")
    @DeleteMapping("/{deviceId}")
    public ResponseEntity<Void> unbind(
            @PathVariable UUID userId,
            @PathVariable String deviceId,
            @AuthenticationPrincipal AuthenticatedPrincipal principal
    ) {
        deviceAdminService.unbind(userId, deviceId, principal.userId());
        return ResponseEntity.noContent().build();
    }
}
