package com.eryxon.gateway.application.service;

import com.eryxon.gateway.domain.model.BrokerConfig;
import com.eryxon.gateway.domain.model.PublishAttempt;
import com.eryxon.gateway.domain.model.PublishOutcome;
import com.eryxon.gateway.domain.repository.BrokerConfigRepository;
import com.eryxon.gateway.domain.repository.PublishAttemptRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * Writes the durable trace of a delivery: one attempt row for every broker of every dispatch,
 * successful or not, followed by the broker's health fields.
 *
 * Health fields are diagnostic only. Two dispatches racing on the same broker simply leave the
 * last writer's values in place.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PublishOutcomeRecorder {

    private final PublishAttemptRepository attemptRepository;
    private final BrokerConfigRepository brokerConfigRepository;
    private final Clock clock;

    /**
     * Records one delivery outcome.
     *
     * @param broker the broker that was targeted
     * @param eventType the dispatched event type
     * @param topic the resolved topic
     * @param payload the wire payload that was sent
     * @param outcome what the transport reported
     * @throws com.eryxon.gateway.domain.exception.StoreUnavailableException if the store rejects the write
     */
    public void record(BrokerConfig broker, String eventType, String topic,
                       Map<String, Object> payload, PublishOutcome outcome) {
        PublishAttempt stored = attemptRepository.append(
                PublishAttempt.of(broker.getId(), eventType, topic, payload, outcome));

        if (outcome.isSuccess()) {
            brokerConfigRepository.markConnected(broker.getId(), Instant.now(clock));
        } else {
            brokerConfigRepository.markFailed(broker.getId(), outcome.getError());
        }

        log.debug("Publish attempt recorded: attemptId={}, brokerId={}, success={}",
                stored.getId(), broker.getId(), outcome.isSuccess());
    }
}
