package com.eryxon.gateway.domain.event;

import com.eryxon.gateway.domain.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A domain event entering the gateway, e.g. "operation.started" for one tenant.
 * Envelopes are never persisted; only the per-broker attempts derived from them are.
 * The data map is opaque and forwarded to brokers verbatim.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class EventEnvelope {

    private final String tenantId;
    private final String eventType;
    private final Map<String, Object> data;
    private final EventContext context;
    private final Instant timestamp;

    /**
     * Creates an envelope. Used by Jackson when envelopes arrive from the inbound Kafka topic;
     * a missing timestamp is filled with the current time.
     */
    @JsonCreator
    public EventEnvelope(
            @JsonProperty("tenant_id") String tenantId,
            @JsonProperty("event_type") String eventType,
            @JsonProperty("data") Map<String, Object> data,
            @JsonProperty("context") EventContext context,
            @JsonProperty("timestamp") Instant timestamp) {
        this.tenantId = tenantId;
        this.eventType = eventType;
        this.data = data == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        this.context = context == null ? EventContext.empty() : context;
        this.timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    /**
     * Validates the envelope before any broker is contacted.
     *
     * @throws ValidationException if tenant id, event type or data is missing
     */
    public void validate() {
        if (tenantId == null || tenantId.isBlank()) {
            throw new ValidationException("tenant_id is required");
        }
        if (eventType == null || eventType.isBlank()) {
            throw new ValidationException("event_type is required");
        }
        if (data == null) {
            throw new ValidationException("data is required");
        }
    }

    /**
     * Builds the JSON-ready body sent to every broker: {event, timestamp, tenant_id, data}.
     */
    public Map<String, Object> toWirePayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event", eventType);
        payload.put("timestamp", timestamp.toString());
        payload.put("tenant_id", tenantId);
        payload.put("data", data);
        return Collections.unmodifiableMap(payload);
    }
}
