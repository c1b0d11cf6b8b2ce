package com.arrowcontrol.protocol.payload;

import com.arrowcontrol.protocol.model.DeviceInfo;

public record RegisterPayload(DeviceInfo deviceInfo) {
}
