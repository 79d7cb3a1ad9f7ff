package com.agrinova.backend.modules.auth.application;

import com.agrinova.backend.modules.auth.domain.ClientPlatform;

public record DeviceContext(String deviceId, String fingerprint, ClientPlatform platform) {
}
