package com.arrowcontrol.protocol.payload;

import com.arrowcontrol.protocol.ErrorCode;

import java.util.Optional;

public record ErrorPayload(int code, String message) {

    public static ErrorPayload of(ErrorCode errorCode, String message) {
        return new ErrorPayload(errorCode.code(), message);
    }

    public Optional<ErrorCode> errorCode() {
        return ErrorCode.fromCode(code);
    }
}
