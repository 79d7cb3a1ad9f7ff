package com.agrinova.backend.modules.auth.presentation.dto;

import com.agrinova.backend.modules.auth.application.AuthorizationDecision;

public record AuthorizeResponse(boolean allowed, String reason) {

    public static AuthorizeResponse from(AuthorizationDecision decision) {
        return new AuthorizeResponse(decision.allowed(), decision.reason() == null ? null : decision.reason().name());
    }
}
