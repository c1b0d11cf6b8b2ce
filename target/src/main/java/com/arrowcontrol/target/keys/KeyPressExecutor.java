package com.arrowcontrol.target.keys;

import com.arrowcontrol.protocol.payload.CommandParameters;

/**
 * Presses a key on this machine. May block for the hold time; never called on an I/O thread.
 */
@FunctionalInterface
public interface KeyPressExecutor {

    /**
     * @param keyName key to press, {@code left} or {@code right}
     * @return {@code true} when every press was delivered
     */
    boolean press(String keyName, CommandParameters parameters);
}
