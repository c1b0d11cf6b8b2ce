package com.arrowcontrol.controller.service;

import com.arrowcontrol.controller.model.RegisteredDevice;

/**
 * Outcome of a pairing attempt; {@code error} carries the operator-facing reason on failure.
 */
public record PairingResult(boolean success, RegisteredDevice device, String error) {

    public static final String DEVICE_NOT_FOUND = "Device not found";
    public static final String PAIRING_NOT_SUPPORTED = "Device does not support pairing";
    public static final String INVALID_TOKEN = "Invalid pairing token";
    public static final String TOKEN_EXPIRED = "Pairing token expired";

    public static PairingResult paired(RegisteredDevice device) {
        return new PairingResult(true, device, null);
    }

    public static PairingResult failed(String error) {
        return new PairingResult(false, null, error);
    }
}
