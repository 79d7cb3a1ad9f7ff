package com.agrinova.backend.modules.rbac.presentation.dto;

import jakarta.validation.constraints.NotNull;

public record ActiveFlagRequest(@NotNull(message = "active is required") Boolean active) {
}
