package com.agrinova.backend.modules.auth.domain;

import java.util.Locale;

public enum TokenKind {
    ACCESS,
    REFRESH,
    OFFLINE;

    public String claimValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TokenKind fromClaim(String value) {
        if (value == null) {
            return null;
        }
        for (TokenKind kind : values()) {
            if (kind.claimValue().equals(value)) {
                return kind;
            }
        }
        return null;
    }
}
