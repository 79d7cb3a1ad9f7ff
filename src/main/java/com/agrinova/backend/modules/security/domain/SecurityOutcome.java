package com.agrinova.backend.modules.security.domain;

public enum SecurityOutcome {
    SUCCESS,
    FAILURE,
    DENIED
}
