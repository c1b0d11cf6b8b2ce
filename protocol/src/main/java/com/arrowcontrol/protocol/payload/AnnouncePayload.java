package com.arrowcontrol.protocol.payload;

import com.arrowcontrol.protocol.model.DeviceInfo;

public record AnnouncePayload(DeviceInfo controllerInfo, int discoveryPort, int controlPort) {
}
