package com.eryxon.gateway.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of one delivery attempt to one broker.
 * Latency covers the whole attempt, including every endpoint candidate that was tried.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class PublishOutcome {

    private final boolean success;
    private final String error;
    private final long latencyMs;

    private PublishOutcome(boolean success, String error, long latencyMs) {
        this.success = success;
        this.error = error;
        this.latencyMs = latencyMs;
    }

    public static PublishOutcome success(long latencyMs) {
        return new PublishOutcome(true, null, latencyMs);
    }

    public static PublishOutcome failure(String error, long latencyMs) {
        if (error == null || error.isBlank()) {
            throw new IllegalArgumentException("A failed outcome needs a diagnostic message");
        }
        return new PublishOutcome(false, error, latencyMs);
    }
}
