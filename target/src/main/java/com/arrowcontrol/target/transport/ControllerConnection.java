package com.arrowcontrol.target.transport;

/**
 * Handle on one session with a controller.
 */
public interface ControllerConnection {

    /**
     * Queues a text frame. Returns {@code false} when the session is not open.
     */
    boolean send(String text);

    boolean isOpen();

    void close();
}
