package com.eryxon.gateway.infrastructure.web.dto;

import com.eryxon.gateway.application.command.BrokerDispatchResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.UUID;

/**
 * One broker's entry in the {@code results} array of a dispatch response.
 */
@Getter
@AllArgsConstructor
public class BrokerResultResponse {

    @JsonProperty("broker_id")
    private final UUID brokerId;

    private final String topic;

    private final boolean success;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private final String error;

    @JsonProperty("latency_ms")
    private final long latencyMs;

    public static BrokerResultResponse from(BrokerDispatchResult result) {
        return new BrokerResultResponse(
                result.getBrokerId(),
                result.getTopic(),
                result.isSuccess(),
                result.getError(),
                result.getLatencyMs()
        );
    }
}
