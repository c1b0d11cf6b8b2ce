package com.arrowcontrol.controller.domain.events;

import com.arrowcontrol.protocol.model.DeviceInfo;

import java.time.Instant;

public record PeerDiscoveredEvent(String ip, DeviceInfo deviceInfo, Instant timestamp) {
}
