package com.eryxon.gateway.application.query;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One row of a broker's publish audit log.
 */
@Getter
@AllArgsConstructor
public class PublishAttemptResponse {

    private final UUID id;

    @JsonProperty("broker_id")
    private final UUID brokerId;

    @JsonProperty("event_type")
    private final String eventType;

    private final String topic;

    private final Map<String, Object> payload;

    private final boolean success;

    @JsonProperty("error_message")
    private final String errorMessage;

    @JsonProperty("latency_ms")
    private final long latencyMs;

    @JsonProperty("created_at")
    private final Instant createdAt;
}
