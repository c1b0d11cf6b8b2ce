package com.arrowcontrol.controller.config;

import com.arrowcontrol.protocol.model.Sender;

/**
 * Resolved identity of this controller process.
 */
public record ControllerIdentity(String id, String name) {

    public static ControllerIdentity from(ControllerProperties properties, String generatedId) {
        String id = isBlank(properties.id()) ? generatedId : properties.id();
        String name = isBlank(properties.name())
                ? "ArrowController-" + id.substring(0, Math.min(8, id.length()))
                : properties.name();
        return new ControllerIdentity(id, name);
    }

    public Sender sender() {
        return Sender.controller(id);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
