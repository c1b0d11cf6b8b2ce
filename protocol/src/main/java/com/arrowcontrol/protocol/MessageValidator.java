package com.arrowcontrol.protocol;

import com.arrowcontrol.protocol.model.DeviceType;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Structural checks every inbound envelope must pass before it is routed.
 * Reports the first violated constraint only.
 */
public final class MessageValidator {

    private MessageValidator() {}

    public static Optional<String> validate(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Optional.of("Message must be an object");
        }
        if (!isText(node.get("type"))) {
            return Optional.of("Message missing required field: type");
        }
        if (!isText(node.get("version"))) {
            return Optional.of("Message missing required field: version");
        }
        JsonNode timestamp = node.get("timestamp");
        if (timestamp == null || !timestamp.isNumber()) {
            return Optional.of("Message missing required field: timestamp");
        }
        JsonNode sender = node.get("sender");
        if (sender == null || !sender.isObject()) {
            return Optional.of("Message missing required field: sender");
        }
        if (!isText(sender.get("id"))) {
            return Optional.of("Sender missing required field: id");
        }
        JsonNode senderType = sender.get("type");
        if (senderType == null || !senderType.isTextual()) {
            return Optional.of("Sender missing required field: type");
        }
        if (DeviceType.fromWire(senderType.asText()).isEmpty()) {
            return Optional.of("Invalid sender type");
        }
        return Optional.empty();
    }

    private static boolean isText(JsonNode value) {
        return value != null && value.isTextual() && !value.asText().isBlank();
    }
}
