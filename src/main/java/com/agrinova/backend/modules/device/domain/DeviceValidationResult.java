package com.agrinova.backend.modules.device.domain;

import java.util.UUID;

public record DeviceValidationResult(UUID bindingId, String deviceId, boolean newlyBound) {
}
