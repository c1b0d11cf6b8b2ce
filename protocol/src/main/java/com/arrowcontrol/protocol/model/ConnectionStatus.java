package com.arrowcontrol.protocol.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Connectivity status of a device as seen by the controller, and of the client as seen by the target.
 */
public enum ConnectionStatus {

    DISCONNECTED("disconnected"),
    CONNECTING("connecting"),
    CONNECTED("connected"),
    PAIRED("paired"),
    ERROR("error");

    private final String wireName;

    ConnectionStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** Connected or paired: a live session exists. */
    public boolean isOnline() {
        return this == CONNECTED || this == PAIRED;
    }
}
