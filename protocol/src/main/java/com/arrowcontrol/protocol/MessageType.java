package com.arrowcontrol.protocol;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Envelope {@code type} values.
 */
public enum MessageType {

    ANNOUNCE("announce"),
    REGISTER("register"),
    REGISTERED("registered"),
    PAIRING_REQUEST("pairing_request"),
    PAIRING_RESPONSE("pairing_response"),
    COMMAND("command"),
    COMMAND_RESULT("command_result"),
    HEARTBEAT("heartbeat"),
    HEARTBEAT_ACK("heartbeat_ack"),
    ERROR("error");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static Optional<MessageType> fromWire(String value) {
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(value))
                .findFirst();
    }
}
