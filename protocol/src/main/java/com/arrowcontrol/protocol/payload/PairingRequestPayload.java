package com.arrowcontrol.protocol.payload;

public record PairingRequestPayload(String pairingToken) {
}
