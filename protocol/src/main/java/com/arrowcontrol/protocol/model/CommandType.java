package com.arrowcontrol.protocol.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Commands a target can execute. {@code keyName} is what the key-press capability receives.
 */
public enum CommandType {

    ARROW_LEFT("arrow_left", "left"),
    ARROW_RIGHT("arrow_right", "right");

    private final String wireName;
    private final String keyName;

    CommandType(String wireName, String keyName) {
        this.wireName = wireName;
        this.keyName = keyName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String keyName() {
        return keyName;
    }

    public static Optional<CommandType> fromWire(String value) {
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(value))
                .findFirst();
    }

    /**
     * Resolves an operator-facing direction ("left", "RIGHT") to its arrow command.
     */
    public static Optional<CommandType> fromDirection(String direction) {
        if (direction == null) {
            return Optional.empty();
        }
        String normalized = direction.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.keyName.equals(normalized))
                .findFirst();
    }
}
