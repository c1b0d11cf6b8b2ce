package com.arrowcontrol.target.client;

import com.arrowcontrol.protocol.model.ConnectionStatus;

/**
 * Observer of a {@link ControlClient}. Called while the client holds its lock, so implementations must return
 * quickly and hand any blocking work to another thread.
 */
public interface ControlClientListener {

    default void onStatusChanged(ConnectionStatus previous, ConnectionStatus current) {
    }

    /**
     * The controller issued a pairing token that has to be echoed back in a pairing request.
     */
    default void onPairingRequired(String pairingToken) {
    }

    default void onPairingRejected(String reason) {
    }

    default void onControllerError(int code, String message) {
    }

    default void onCommandExecuted(String commandType, boolean success, String error) {
    }

    /**
     * Reconnection stopped for good after the configured number of attempts.
     */
    default void onReconnectGaveUp(int attempts) {
    }
}
