package com.agrinova.backend.modules.auth.application;

import com.agrinova.backend.modules.auth.domain.ClientPlatform;

/**
 * @param device absent for web logins
 * @param offline request an offline token; honoured for mobile platforms only
 */
public record LoginCommand(
        String identifier,
        String secret,
        String sourceAddress,
        DeviceContext device,
        boolean offline
) {

    public ClientPlatform platform() {
        return device != null && device.platform() != null ? device.platform() : ClientPlatform.WEB;
    }
}
