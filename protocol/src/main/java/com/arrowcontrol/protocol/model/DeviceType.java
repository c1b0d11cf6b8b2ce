package com.arrowcontrol.protocol.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum DeviceType {

    CONTROLLER("controller"),
    TARGET("target");

    private final String wireName;

    DeviceType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static Optional<DeviceType> fromWire(String value) {
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(value))
                .findFirst();
    }

    @JsonCreator
    static DeviceType fromJson(String value) {
        return fromWire(value).orElseThrow(() -> new IllegalArgumentException("Invalid device type: " + value));
    }
}
