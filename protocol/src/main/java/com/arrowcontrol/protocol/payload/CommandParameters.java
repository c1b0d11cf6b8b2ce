package com.arrowcontrol.protocol.payload;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Arrow command parameters.
 *
 * <p>{@code repeat} is the number of discrete taps (default 1, must be positive). {@code holdTime} is how long
 * each press is held in milliseconds before release (default 0 for an instantaneous tap, never negative).
 * Missing values take their defaults; out-of-range values are rejected.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CommandParameters(String direction, Integer repeat, Integer holdTime) {

    public static final int DEFAULT_REPEAT = 1;
    public static final int DEFAULT_HOLD_TIME = 0;

    public CommandParameters {
        if (repeat == null) {
            repeat = DEFAULT_REPEAT;
        }
        if (holdTime == null) {
            holdTime = DEFAULT_HOLD_TIME;
        }
        if (repeat < 1) {
            throw new IllegalArgumentException("repeat must be a positive integer, got " + repeat);
        }
        if (holdTime < 0) {
            throw new IllegalArgumentException("holdTime must be a non-negative integer, got " + holdTime);
        }
    }

    public static CommandParameters of(String direction) {
        return new CommandParameters(direction, null, null);
    }
}
