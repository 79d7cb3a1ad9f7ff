package com.agrinova.backend.modules.auth.domain;

import java.util.Locale;

public enum ClientPlatform {
    WEB,
    ANDROID,
    IOS;

    public boolean isMobile() {
        return this != WEB;
    }

    public static ClientPlatform from(String raw) {
        if (raw == null || raw.isBlank()) {
            return WEB;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        if ("MOBILE".equals(normalized)) {
            return ANDROID;
        }
        return ClientPlatform.valueOf(normalized);
    }
}
