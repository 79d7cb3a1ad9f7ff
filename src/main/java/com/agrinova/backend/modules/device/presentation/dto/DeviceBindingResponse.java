package com.agrinova.backend.modules.device.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.agrinova.backend.modules.device.domain.DeviceBinding;

public record DeviceBindingResponse(
        UUID bindingId,
        UUID userId,
        String deviceId,
        String platform,
        String state,
        OffsetDateTime registeredAt,
        OffsetDateTime lastSeenAt,
        OffsetDateTime revokedAt,
        UUID revokedBy
) {

    public static DeviceBindingResponse from(DeviceBinding binding) {
        return new DeviceBindingResponse(
                binding.getId(),
                binding.getUserId(),
                binding.getDeviceId(),
                binding.getPlatform().name(),
                binding.getState().name(),
                binding.getRegisteredAt(),
                binding.getLastSeenAt(),
                binding.getRevokedAt(),
                binding.getRevokedBy()
        );
    }
}
