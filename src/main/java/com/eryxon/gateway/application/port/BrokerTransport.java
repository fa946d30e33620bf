package com.eryxon.gateway.application.port;

import com.eryxon.gateway.domain.model.BrokerConfig;
import com.eryxon.gateway.domain.model.PublishOutcome;

import java.util.Map;

/**
 * Port interface for delivering one message to one broker.
 * Implemented by infrastructure adapters (HTTP bridge, circuit-breaker decorator).
 *
 * Implementations never throw for delivery problems: unreachable hosts, timeouts and
 * rejected requests all come back as a failed {@link PublishOutcome} with a diagnostic message.
 */
public interface BrokerTransport {

    /**
     * Publishes a payload to a topic on the given broker.
     *
     * @param broker the target broker
     * @param topic the resolved topic
     * @param payload the wire payload, serialized to JSON by the implementation
     * @return the outcome, with latency measured across the whole call
     * @throws IllegalArgumentException if broker or topic is null
     */
    PublishOutcome publish(BrokerConfig broker, String topic, Map<String, Object> payload);
}
