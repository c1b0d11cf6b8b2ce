package com.arrowcontrol.protocol;

import com.arrowcontrol.protocol.model.ProtocolMessage;

/**
 * Outcome of decoding one inbound text frame: either a validated envelope or the rejection reason.
 */
public record DecodeResult(ProtocolMessage message, String error) {

    public static DecodeResult accepted(ProtocolMessage message) {
        return new DecodeResult(message, null);
    }

    public static DecodeResult rejected(String error) {
        return new DecodeResult(null, error);
    }

    public boolean isValid() {
        return message != null;
    }
}
