package com.agrinova.backend.modules.auth.presentation.dto;

import com.agrinova.backend.modules.auth.application.SessionResult;

public record LoginResponse(TokenPairResponse tokens, SessionUserResponse user) {

    public static LoginResponse from(SessionResult result) {
        return new LoginResponse(
                TokenPairResponse.from(result.tokens()),
                SessionUserResponse.from(result.identity(), result.permissions())
        );
    }
}
