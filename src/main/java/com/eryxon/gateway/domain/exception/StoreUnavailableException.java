package com.eryxon.gateway.domain.exception;

/**
 * Exception thrown when the broker configuration store or the attempt log cannot be reached.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
