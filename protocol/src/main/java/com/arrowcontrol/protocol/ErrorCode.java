package com.arrowcontrol.protocol;

import java.util.Arrays;
import java.util.Optional;

/**
 * Stable numeric codes carried by {@code error} messages.
 */
public enum ErrorCode {

    INVALID_MESSAGE(100),
    AUTHENTICATION_FAILED(101),
    INVALID_COMMAND(102),
    INTERNAL_ERROR(103),
    NOT_PAIRED(104);

    private final int code;

    ErrorCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static Optional<ErrorCode> fromCode(int code) {
        return Arrays.stream(values())
                .filter(errorCode -> errorCode.code == code)
                .findFirst();
    }
}
