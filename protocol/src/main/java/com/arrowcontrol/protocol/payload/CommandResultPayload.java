package com.arrowcontrol.protocol.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CommandResultPayload(String commandType, boolean success, String error, JsonNode result) {

    public static CommandResultPayload succeeded(String commandType) {
        return new CommandResultPayload(commandType, true, null, null);
    }

    public static CommandResultPayload failed(String commandType, String error) {
        return new CommandResultPayload(commandType, false, error, null);
    }
}
