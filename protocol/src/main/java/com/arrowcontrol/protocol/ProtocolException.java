package com.arrowcontrol.protocol;

/**
 * Raised when a message or payload cannot be encoded or bound to its typed form.
 */
public class ProtocolException extends RuntimeException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
