package com.eryxon.gateway.domain.exception;

import java.util.UUID;

/**
 * Exception thrown when a query names a broker that does not exist.
 */
public class BrokerNotFoundException extends RuntimeException {

    public BrokerNotFoundException(UUID brokerId) {
        super("Broker not found: " + brokerId);
    }
}
