package com.arrowcontrol.controller.exception;

import com.arrowcontrol.controller.dto.ApiResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Renders every operator API failure as an {@link ApiResponse}.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ArrowControlException.class)
    public ResponseEntity<ApiResponse<Void>> handleArrowControlException(ArrowControlException ex,
                                                                         HttpServletRequest request) {
        if (ex.getHttpStatus().is5xxServerError()) {
            log.error("🚨 {} at {}", ex.getFormattedMessage(), request.getRequestURI(), ex);
        } else {
            log.warn("⚠️ {} at {}", ex.getFormattedMessage(), request.getRequestURI());
        }

        ApiResponse<Void> response = ApiResponse.error(
            ApiResponse.ErrorDetails.builder()
                .code(ex.getErrorCode())
                .message(ex.getMessage())
                .details(ex.getDetails())
                .path(request.getRequestURI())
                .build()
        );
        return ResponseEntity.status(ex.getHttpStatus()).body(response);
    }

    /**
     * 📝 Handles validation errors from @Valid annotations
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidationError(MethodArgumentNotValidException ex,
                                                                   HttpServletRequest request) {
        log.warn("📝 Validation error at {}: {}", request.getRequestURI(), ex.getMessage());

        String validationMessage = ex.getBindingResult().getAllErrors().stream()
            .map(error -> error.getDefaultMessage())
            .reduce((a, b) -> a + "; " + b)
            .orElse("Validation failed");

        ApiResponse<Void> response = ApiResponse.error(
            ApiResponse.ErrorDetails.builder()
                .code("VALIDATION_ERROR")
                .message("Request validation failed")
                .details(validationMessage)
                .path(request.getRequestURI())
                .build()
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiResponse<Void>> handleConstraintViolation(ConstraintViolationException ex,
                                                                       HttpServletRequest request) {
        log.warn("📝 Constraint violation at {}: {}", request.getRequestURI(), ex.getMessage());

        ApiResponse<Void> response = ApiResponse.error(
            ApiResponse.ErrorDetails.builder()
                .code("VALIDATION_ERROR")
                .message("Request validation failed")
                .details(ex.getMessage())
                .path(request.getRequestURI())
                .build()
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ApiResponse<Void>> handleMethodValidation(HandlerMethodValidationException ex,
                                                                    HttpServletRequest request) {
        log.warn("📝 Parameter validation failed at {}: {}", request.getRequestURI(), ex.getMessage());

        String validationMessage = ex.getAllErrors().stream()
            .map(error -> error.getDefaultMessage())
            .reduce((a, b) -> a + "; " + b)
            .orElse("Validation failed");

        ApiResponse<Void> response = ApiResponse.error(
            ApiResponse.ErrorDetails.builder()
                .code("VALIDATION_ERROR")
                .message("Request validation failed")
                .details(validationMessage)
                .path(request.getRequestURI())
                .build()
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnreadableBody(HttpMessageNotReadableException ex,
                                                                  HttpServletRequest request) {
        log.warn("📝 Unreadable request body at {}: {}", request.getRequestURI(), ex.getMessage());

        ApiResponse<Void> response = ApiResponse.error(
            ApiResponse.ErrorDetails.builder()
                .code("MALFORMED_REQUEST")
                .message("Request body could not be read")
                .path(request.getRequestURI())
                .build()
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    /**
     * 🔧 Handles method argument type mismatch
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Void>> handleTypeMismatch(MethodArgumentTypeMismatchException ex,
                                                                HttpServletRequest request) {
        log.warn("🔧 Type mismatch error at {}: {}", request.getRequestURI(), ex.getMessage());

        String expectedType = ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "unknown";
        ApiResponse<Void> response = ApiResponse.error(
            ApiResponse.ErrorDetails.builder()
                .code("TYPE_MISMATCH")
                .message("Invalid parameter type")
                .details(String.format("Parameter '%s' should be of type %s", ex.getName(), expectedType))
                .path(request.getRequestURI())
                .field(ex.getName())
                .build()
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    /**
     * 🌐 Catches all other exceptions
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGenericException(Exception ex, HttpServletRequest request) {
        log.error("🌐 Unexpected error at {}: {}", request.getRequestURI(), ex.getMessage(), ex);

        ApiResponse<Void> response = ApiResponse.error(
            ApiResponse.ErrorDetails.builder()
                .code("INTERNAL_ERROR")
                .message("An internal error occurred")
                .path(request.getRequestURI())
                .build()
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }
}
