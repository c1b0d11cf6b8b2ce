package com.arrowcontrol.controller.domain.events;

import java.time.Instant;

public record ConnectionEvent(Kind kind, String connectionId, String remoteAddress, String deviceId,
                              Instant timestamp) {

    public enum Kind {
        OPENED,
        CLOSED,
        TERMINATED,
        SUPERSEDED
    }
}
