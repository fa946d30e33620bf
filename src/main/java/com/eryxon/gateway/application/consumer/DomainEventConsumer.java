package com.eryxon.gateway.application.consumer;

import com.eryxon.gateway.application.command.DispatchEventCommand;
import com.eryxon.gateway.application.command.DispatchEventCommandHandler;
import com.eryxon.gateway.application.command.DispatchResult;
import com.eryxon.gateway.domain.event.EventEnvelope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Service;

/**
 * DomainEventConsumer feeds domain events published on Kafka into the dispatch coordinator.
 * It is the asynchronous counterpart of {@code POST /api/v1/events/publish}.
 *
 * Key responsibilities:
 * - Consume event envelopes from the inbound topic
 * - Dispatch each one to the tenant's subscribed brokers
 * - Manually commit Kafka offsets once the dispatch has returned
 *
 * Per-broker failures do not cause a redelivery: they are recorded as attempts like any other
 * dispatch. Only call-level errors (invalid envelope, store unavailable) reach the error handler.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "gateway.kafka", name = "enabled", havingValue = "true")
public class DomainEventConsumer {

    private final DispatchEventCommandHandler commandHandler;

    /**
     * @param envelope the event read from the inbound topic
     * @param acknowledgment the Kafka acknowledgment for manual offset commit
     */
    @KafkaListener(
            topics = "${gateway.kafka.inbound-topic}",
            groupId = "${spring.kafka.consumer.group-id}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consume(EventEnvelope envelope, Acknowledgment acknowledgment) {
        log.debug("Received domain event: tenantId={}, eventType={}",
                envelope.getTenantId(), envelope.getEventType());

        try {
            DispatchResult result = commandHandler.handle(new DispatchEventCommand(
                    envelope.getTenantId(),
                    envelope.getEventType(),
                    envelope.getData(),
                    envelope.getContext()
            ));

            log.info("Domain event dispatched from Kafka: tenantId={}, eventType={}, published={}, failed={}",
                    envelope.getTenantId(), envelope.getEventType(), result.getPublished(), result.getFailed());

            acknowledgment.acknowledge();
        } catch (RuntimeException e) {
            log.error("Error dispatching domain event: tenantId={}, eventType={}",
                    envelope.getTenantId(), envelope.getEventType(), e);
            // Not acknowledged: the container error handler retries or dead-letters it
            throw e;
        }
    }
}
