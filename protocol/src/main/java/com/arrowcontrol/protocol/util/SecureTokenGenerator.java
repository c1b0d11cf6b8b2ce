package com.arrowcontrol.protocol.util;

import com.arrowcontrol.protocol.ProtocolConstants;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Hex-encoded tokens of {@link ProtocolConstants#TOKEN_BYTES} cryptographically random bytes.
 */
public class SecureTokenGenerator implements TokenGenerator {

    private final SecureRandom random;
    private final int length;

    public SecureTokenGenerator() {
        this(new SecureRandom(), ProtocolConstants.TOKEN_BYTES);
    }

    public SecureTokenGenerator(SecureRandom random, int length) {
        if (length < 1) {
            throw new IllegalArgumentException("Token length must be at least 1 byte");
        }
        this.random = random;
        this.length = length;
    }

    @Override
    public String generate() {
        byte[] bytes = new byte[length];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
