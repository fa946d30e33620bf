package com.eryxon.gateway.infrastructure.web.exception;

import com.eryxon.gateway.domain.exception.BrokerNotFoundException;
import com.eryxon.gateway.domain.exception.StoreUnavailableException;
import com.eryxon.gateway.domain.exception.ValidationException;
import com.eryxon.gateway.infrastructure.web.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

/**
 * Global exception handler for REST API endpoints.
 * Provides consistent error responses and appropriate HTTP status codes.
 *
 * Per-broker delivery failures never reach this handler; they are part of a successful
 * dispatch response.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Handle domain validation exceptions.
     * Returns 400 Bad Request when a required event field is missing.
     */
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(ValidationException ex) {
        log.warn("Validation error: {}", ex.getMessage());
        return badRequest(ex.getMessage());
    }

    /**
     * Handle bean validation failures on request bodies.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
            .map(FieldError::getDefaultMessage)
            .sorted()
            .collect(Collectors.joining(", "));
        log.warn("Request validation error: {}", message);
        return badRequest(message);
    }

    /**
     * Handle malformed JSON bodies.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableMessage(HttpMessageNotReadableException ex) {
        log.warn("Malformed request body: {}", ex.getMostSpecificCause().getMessage());
        return badRequest("Malformed request body");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        log.warn("Invalid request parameter: name={}, value={}", ex.getName(), ex.getValue());
        return badRequest("Invalid value for " + ex.getName());
    }

    /**
     * Handle unknown broker ids.
     * Returns 404 Not Found.
     */
    @ExceptionHandler(BrokerNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleBrokerNotFound(BrokerNotFoundException ex) {
        log.info("Broker not found: {}", ex.getMessage());
        ErrorResponse errorResponse = new ErrorResponse(
            ErrorResponse.NOT_FOUND,
            HttpStatus.NOT_FOUND.value(),
            ex.getMessage()
        );
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(errorResponse);
    }

    /**
     * Handle store unavailable exceptions.
     * Returns 503 Service Unavailable when the database is down or unreachable.
     */
    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleStoreUnavailable(StoreUnavailableException ex) {
        log.error("Store unavailable: {}", ex.getMessage(), ex);
        ErrorResponse errorResponse = new ErrorResponse(
            ErrorResponse.SERVICE_UNAVAILABLE,
            HttpStatus.SERVICE_UNAVAILABLE.value(),
            "Service temporarily unavailable"
        );
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(errorResponse);
    }

    /**
     * Handle all other unexpected exceptions.
     * Returns 500 Internal Server Error for unhandled exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unexpected error occurred: {}", ex.getMessage(), ex);
        ErrorResponse errorResponse = new ErrorResponse(
            ErrorResponse.INTERNAL_ERROR,
            HttpStatus.INTERNAL_SERVER_ERROR.value(),
            "Internal server error"
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }

    private ResponseEntity<ErrorResponse> badRequest(String message) {
        ErrorResponse errorResponse = new ErrorResponse(
            ErrorResponse.VALIDATION_ERROR,
            HttpStatus.BAD_REQUEST.value(),
            message
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
    }
}
