package com.arrowcontrol.protocol.payload;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PairingResponsePayload(boolean accepted, String authToken, String error) {

    public static PairingResponsePayload accepted(String authToken) {
        return new PairingResponsePayload(true, authToken, null);
    }

    public static PairingResponsePayload rejected(String error) {
        return new PairingResponsePayload(false, null, error);
    }
}
