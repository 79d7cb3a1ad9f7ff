package com.agrinova.backend.modules.device.presentation.dto;

import java.util.List;

public record DeviceBindingListResponse(List<DeviceBindingResponse> items) {
}
