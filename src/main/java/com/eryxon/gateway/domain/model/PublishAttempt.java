package com.eryxon.gateway.domain.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Audit record of one delivery attempt: one per broker per dispatch call.
 * Attempts are append-only; nothing in the gateway changes or removes them once written.
 */
@Getter
@AllArgsConstructor
@ToString(exclude = "payload")
public final class PublishAttempt {

    private final UUID id;
    private final UUID brokerId;
    private final String eventType;
    private final String topic;
    private final Map<String, Object> payload;
    private final boolean success;
    private final String errorMessage;
    private final long latencyMs;
    private final Instant createdAt;

    /**
     * Creates a not-yet-persisted attempt from an adapter outcome. Id and creation time are
     * assigned by the store.
     */
    public static PublishAttempt of(UUID brokerId, String eventType, String topic,
                                    Map<String, Object> payload, PublishOutcome outcome) {
        return new PublishAttempt(
                null,
                brokerId,
                eventType,
                topic,
                payload,
                outcome.isSuccess(),
                outcome.getError(),
                outcome.getLatencyMs(),
                null
        );
    }
}
