package com.arrowcontrol.protocol.model;

/**
 * Envelope sender block.
 */
public record Sender(String id, DeviceType type) {

    public static Sender controller(String id) {
        return new Sender(id, DeviceType.CONTROLLER);
    }

    public static Sender target(String id) {
        return new Sender(id, DeviceType.TARGET);
    }
}
