package com.agrinova.backend.modules.device.domain;

public enum DeviceBindingState {
    UNREGISTERED,
    BOUND,
    REVOKED
}
