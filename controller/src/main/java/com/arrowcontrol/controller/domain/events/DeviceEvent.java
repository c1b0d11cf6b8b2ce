package com.arrowcontrol.controller.domain.events;

import com.arrowcontrol.protocol.model.ConnectionStatus;

import java.time.Instant;

/**
 * Registry state change. {@code previousId} is set only when a record migrated to a new id.
 */
public record DeviceEvent(Kind kind, String deviceId, String previousId, ConnectionStatus status,
                          boolean paired, Instant timestamp) {

    public enum Kind {
        REGISTERED,
        UPDATED,
        CONNECTED,
        DISCONNECTED,
        PAIRED,
        UNPAIRED,
        REMOVED
    }
}
