package com.arrowcontrol.protocol.payload;

/**
 * {@code commandType} stays a raw string so the target can reject kinds it does not recognize.
 */
public record CommandPayload(String commandType, CommandParameters parameters) {
}
