package com.agrinova.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record OfflineTokenRequest(
        @NotBlank(message = "offlineToken is required") String offlineToken,
        @Size(max = 100) String deviceId,
        @Size(max = 512) String deviceFingerprint
) {
}
