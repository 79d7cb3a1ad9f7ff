package com.agrinova.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record LoginRequest(
        @NotBlank(message = "identifier is required") @Size(max = 320) String identifier,
        @NotBlank(message = "password is required") @Size(max = 256) String password,
        @Size(max = 100) String deviceId,
        @Size(max = 512) String deviceFingerprint,
        @Pattern(regexp = "(?i)WEB|ANDROID|IOS|MOBILE", message = "platform must be WEB, ANDROID, IOS or MOBILE")
        String platform,
        boolean offline
) {
}
