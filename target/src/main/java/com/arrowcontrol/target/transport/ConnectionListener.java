package com.arrowcontrol.target.transport;

/**
 * Callbacks from one transport session. {@link #onClosed} fires exactly once per session, whether the
 * session failed to open, errored or was closed by either side.
 */
public interface ConnectionListener {

    void onOpen(ControllerConnection connection);

    void onMessage(ControllerConnection connection, String text);

    /**
     * @param cause the failure that ended the session, or {@code null} for an orderly close
     */
    void onClosed(ControllerConnection connection, Throwable cause);
}
