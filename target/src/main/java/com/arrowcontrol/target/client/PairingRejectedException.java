package com.arrowcontrol.target.client;

/**
 * Completes a pairing request the controller answered with {@code accepted: false}.
 */
public class PairingRejectedException extends RuntimeException {

    public PairingRejectedException(String reason) {
        super(reason != null ? reason : "Pairing failed");
    }
}
