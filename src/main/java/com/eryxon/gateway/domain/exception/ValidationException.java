package com.eryxon.gateway.domain.exception;

/**
 * Exception thrown when an inbound event or query does not meet the gateway's input rules.
 * This is the only error that rejects a dispatch call as a whole.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
