package com.eryxon.gateway.domain.model;

/**
 * How a broker is reached over its HTTP publish bridge.
 * {@link #AUTO} tries every known vendor endpoint in order; the other values pin one vendor.
 */
public enum TransportKind {
    AUTO,
    HIVEMQ,
    EMQX,
    GENERIC_REST
}
