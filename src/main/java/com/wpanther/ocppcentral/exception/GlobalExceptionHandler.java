package com.wpanther.ocppcentral.exception;

import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;

@ControllerAdvice
@Slf4j
@Order(Ordered.HIGHEST_PRECEDENCE)
public class GlobalExceptionHandler {

    @ExceptionHandler(ChargePointNotConnectedException.class)
    public ResponseEntity<ErrorResponse> handleNotConnected(ChargePointNotConnectedException ex) {
        log.warn("Command for unconnected charge point: {}", ex.getIdentity());
        return createErrorResponse(ex.getMessage(), HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(OcppCallTimeoutException.class)
    public ResponseEntity<ErrorResponse> handleCallTimeout(OcppCallTimeoutException ex) {
        log.warn("Command timed out: {}", ex.getMessage());
        return createErrorResponse(ex.getMessage(), HttpStatus.GATEWAY_TIMEOUT);
    }

    @ExceptionHandler(OcppCallErrorException.class)
    public ResponseEntity<ErrorResponse> handleCallError(OcppCallErrorException ex) {
        log.warn("Command rejected: {}", ex.getMessage());
        return createErrorResponse(ex.getMessage(), HttpStatus.BAD_GATEWAY);
    }

    @ExceptionHandler(OcppCommandException.class)
    public ResponseEntity<ErrorResponse> handleCommandException(OcppCommandException ex) {
        log.error("Command error", ex);
        return createErrorResponse(ex.getMessage(), HttpStatus.BAD_GATEWAY);
    }

    /**
     * Command futures complete with a wrapped cause
     */
    @ExceptionHandler(CompletionException.class)
    public ResponseEntity<ErrorResponse> handleCompletionException(CompletionException ex) {
        Throwable cause = ex.getCause();
        if (cause instanceof ChargePointNotConnectedException) {
            return handleNotConnected((ChargePointNotConnectedException) cause);
        }
        if (cause instanceof OcppCallTimeoutException) {
            return handleCallTimeout((OcppCallTimeoutException) cause);
        }
        if (cause instanceof OcppCallErrorException) {
            return handleCallError((OcppCallErrorException) cause);
        }
        if (cause instanceof OcppCommandException) {
            return handleCommandException((OcppCommandException) cause);
        }
        log.error("Unexpected asynchronous error", ex);
        return createErrorResponse("An unexpected error occurred: " + ex.getMessage(), HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Invalid request: {}", ex.getMessage());
        return createErrorResponse(ex.getMessage(), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ValidationErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        log.error("Validation error", ex);

        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = ((FieldError) error).getField();
            errors.put(fieldName, error.getDefaultMessage());
        });

        ValidationErrorResponse errorResponse = new ValidationErrorResponse(
            "Validation failed",
            HttpStatus.BAD_REQUEST.value(),
            Instant.now(),
            errors
        );
        return new ResponseEntity<>(errorResponse, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(Exception ex) {
        log.error("Unexpected error", ex);
        return createErrorResponse("An unexpected error occurred: " + ex.getMessage(), HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private ResponseEntity<ErrorResponse> createErrorResponse(String message, HttpStatus status) {
        ErrorResponse errorResponse = new ErrorResponse(
            message,
            status.value(),
            Instant.now()
        );
        return new ResponseEntity<>(errorResponse, status);
    }

    public static class ErrorResponse {
        private final String message;
        private final int status;
        private final Instant timestamp;

        public ErrorResponse(String message, int status, Instant timestamp) {
            this.message = message;
            this.status = status;
            this.timestamp = timestamp;
        }

        public String getMessage() {
            return message;
        }

        public int getStatus() {
            return status;
        }

        public Instant getTimestamp() {
            return timestamp;
        }
    }

    public static class ValidationErrorResponse extends ErrorResponse {
        private final Map<String, String> errors;

        public ValidationErrorResponse(String message, int status, Instant timestamp, Map<String, String> errors) {
            super(message, status, timestamp);
            this.errors = errors;
        }

        public Map<String, String> getErrors() {
            return errors;
        }
    }
}
