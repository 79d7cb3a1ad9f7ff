package com.agrinova.backend.modules.security.domain;

public enum SecuritySeverity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL
}
