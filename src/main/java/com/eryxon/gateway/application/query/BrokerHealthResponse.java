package com.eryxon.gateway.application.query;

import com.eryxon.gateway.domain.model.BrokerHealth;
import com.eryxon.gateway.domain.model.TransportKind;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;
import java.util.UUID;

/**
 * Read model of one broker's health as returned to operators.
 */
@Getter
@AllArgsConstructor
public class BrokerHealthResponse {

    @JsonProperty("broker_id")
    private final UUID brokerId;

    private final String name;

    private final boolean active;

    @JsonProperty("transport_kind")
    private final TransportKind transportKind;

    private final BrokerHealth.Status status;

    @JsonProperty("sample_size")
    private final int sampleSize;

    @JsonProperty("success_count")
    private final int successCount;

    @JsonProperty("success_rate")
    private final double successRate;

    @JsonProperty("last_attempt_at")
    private final Instant lastAttemptAt;

    @JsonProperty("last_connected_at")
    private final Instant lastConnectedAt;

    @JsonProperty("last_error")
    private final String lastError;
}
