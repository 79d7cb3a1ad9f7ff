package com.agrinova.backend.modules.auth.domain;

import com.agrinova.backend.global.error.ProblemException;

public class AuthException extends ProblemException {

    private final AuthFailureKind kind;

    public AuthException(AuthFailureKind kind) {
        this(kind, null);
    }

    public AuthException(AuthFailureKind kind, Throwable cause) {
        super(kind.getStatus(), kind.name(), kind.getDefaultDetail(), cause);
        this.kind = kind;
    }

    public AuthFailureKind getKind() {
        return kind;
    }
}
