package com.arrowcontrol.protocol.payload;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Reply to {@code register}. The pairing token is present only while the device is unpaired.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RegisteredPayload(String deviceId, boolean pairingRequired, String pairingToken) {
}
