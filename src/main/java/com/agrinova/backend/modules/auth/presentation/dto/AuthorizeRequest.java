package com.agrinova.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record AuthorizeRequest(@NotBlank(message = "permission is required") String permission) {
}
