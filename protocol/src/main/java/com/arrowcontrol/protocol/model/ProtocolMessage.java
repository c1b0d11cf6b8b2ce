package com.arrowcontrol.protocol.model;

import com.arrowcontrol.protocol.MessageType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Envelope of every message on the wire. {@code type} is kept as received so that unknown kinds can be
 * answered with an error instead of failing to decode.
 */
public record ProtocolMessage(String type, String version, long timestamp, Sender sender, JsonNode data) {

    @JsonIgnore
    public Optional<MessageType> messageType() {
        return MessageType.fromWire(type);
    }

    public boolean is(MessageType messageType) {
        return messageType.wireName().equals(type);
    }
}
