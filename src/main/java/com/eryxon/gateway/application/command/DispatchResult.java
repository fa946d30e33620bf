package com.eryxon.gateway.application.command;

import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.List;

/**
 * Aggregated outcome of a dispatch call.
 * Per-broker results are independent of each other and carry no ordering guarantee.
 */
@Getter
@ToString
public class DispatchResult {

    private final String message;
    private final int published;
    private final int failed;
    private final List<BrokerDispatchResult> results;

    private DispatchResult(String message, List<BrokerDispatchResult> results) {
        this.message = message;
        this.results = Collections.unmodifiableList(results);
        this.published = (int) results.stream().filter(BrokerDispatchResult::isSuccess).count();
        this.failed = results.size() - published;
    }

    /**
     * Result for an event no active broker subscribed to.
     */
    public static DispatchResult noMatchingBrokers(String eventType) {
        return new DispatchResult("No active brokers subscribed to " + eventType, List.of());
    }

    public static DispatchResult of(List<BrokerDispatchResult> results) {
        long successes = results.stream().filter(BrokerDispatchResult::isSuccess).count();
        return new DispatchResult(
                "Published to " + successes + " of " + results.size() + " broker(s)", results);
    }
}
