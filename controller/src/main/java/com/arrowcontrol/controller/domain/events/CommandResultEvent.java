package com.arrowcontrol.controller.domain.events;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Asynchronous execution outcome reported by a target, correlated by device and command type.
 */
public record CommandResultEvent(String deviceId, String commandType, boolean success, String error,
                                 JsonNode result, Instant timestamp) {
}
