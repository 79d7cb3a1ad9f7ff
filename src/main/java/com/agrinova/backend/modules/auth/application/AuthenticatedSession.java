package com.agrinova.backend.modules.auth.application;

import com.agrinova.backend.modules.auth.domain.TokenClaims;
import com.agrinova.backend.modules.rbac.domain.EffectivePermissions;

public record AuthenticatedSession(TokenClaims claims, EffectivePermissions permissions) {
}
