package com.arrowcontrol.controller.service;

/**
 * Local outcome of dispatching a command. {@code sent} only means the transport accepted the frame; execution
 * is reported later through a command result.
 */
public record CommandDispatchResult(boolean sent, Failure failure, String message) {

    public enum Failure {
        INVALID_PARAMETERS,
        DEVICE_NOT_FOUND,
        DEVICE_NOT_CONNECTED,
        DEVICE_NOT_PAIRED,
        COMMAND_NOT_SUPPORTED,
        NO_ACTIVE_CONNECTION
    }

    public static CommandDispatchResult sent(String message) {
        return new CommandDispatchResult(true, null, message);
    }

    public static CommandDispatchResult rejected(Failure failure, String message) {
        return new CommandDispatchResult(false, failure, message);
    }
}
