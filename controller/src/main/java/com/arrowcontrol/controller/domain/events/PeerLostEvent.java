package com.arrowcontrol.controller.domain.events;

import com.arrowcontrol.protocol.model.DeviceInfo;

import java.time.Instant;

/**
 * A discovered peer stopped broadcasting for longer than the peer TTL.
 */
public record PeerLostEvent(String ip, DeviceInfo deviceInfo, Instant lastSeen, Instant timestamp) {
}
