package com.agrinova.backend.modules.auth.domain;

public enum AppUserStatus {
    ACTIVE,
    INACTIVE
}
