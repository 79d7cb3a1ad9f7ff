package com.agrinova.backend.modules.auth.presentation.dto;

public record SessionsRevokedResponse(int revokedSessions) {
}
