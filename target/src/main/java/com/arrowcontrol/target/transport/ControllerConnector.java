package com.arrowcontrol.target.transport;

/**
 * Opens sessions to a controller. Connecting is asynchronous: the returned handle reports through the
 * listener once the session opens or fails.
 */
public interface ControllerConnector {

    ControllerConnection connect(String host, int port, ConnectionListener listener);
}
