package com.arrowcontrol.controller.exception;

import com.arrowcontrol.controller.service.CommandDispatchResult;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Operator API failure carrying a stable error code and the HTTP status to answer with.
 */
@Getter
public class ArrowControlException extends RuntimeException {

    private final String errorCode;
    private final String details;
    private final HttpStatus httpStatus;

    public ArrowControlException(String message, String errorCode, HttpStatus httpStatus) {
        this(message, errorCode, null, httpStatus);
    }

    public ArrowControlException(String message, String errorCode, String details, HttpStatus httpStatus) {
        super(message);
        this.errorCode = errorCode;
        this.details = details;
        this.httpStatus = httpStatus;
    }

    // 🏭 Static Factory Methods

    public static ArrowControlException deviceNotFound(String deviceId) {
        return new ArrowControlException("Device not found: " + deviceId, "DEVICE_NOT_FOUND", HttpStatus.NOT_FOUND);
    }

    public static ArrowControlException badRequest(String message) {
        return new ArrowControlException(message, "BAD_REQUEST", HttpStatus.BAD_REQUEST);
    }

    /**
     * Maps a rejected dispatch to the status an operator should see.
     */
    public static ArrowControlException commandRejected(String deviceId, CommandDispatchResult result) {
        HttpStatus status = switch (result.failure()) {
            case DEVICE_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_PARAMETERS, COMMAND_NOT_SUPPORTED -> HttpStatus.BAD_REQUEST;
            case DEVICE_NOT_CONNECTED, DEVICE_NOT_PAIRED, NO_ACTIVE_CONNECTION -> HttpStatus.CONFLICT;
        };
        return new ArrowControlException(result.message(), result.failure().name(), "deviceId=" + deviceId, status);
    }

    public String getFormattedMessage() {
        return String.format("[%s] %s - %s", errorCode, getMessage(), details != null ? details : "");
    }
}
