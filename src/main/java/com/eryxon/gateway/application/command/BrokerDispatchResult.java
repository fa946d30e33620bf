package com.eryxon.gateway.application.command;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.UUID;

/**
 * Outcome of one broker's delivery within a dispatch call.
 */
@Getter
@AllArgsConstructor
@ToString
public class BrokerDispatchResult {

    private final UUID brokerId;
    private final String topic;
    private final boolean success;
    private final String error;
    private final long latencyMs;
}
