package com.eryxon.gateway.application.command;

import com.eryxon.gateway.application.port.BrokerTransport;
import com.eryxon.gateway.application.service.PublishOutcomeRecorder;
import com.eryxon.gateway.application.service.SubscribedBrokerFinder;
import com.eryxon.gateway.domain.event.EventEnvelope;
import com.eryxon.gateway.domain.exception.StoreUnavailableException;
import com.eryxon.gateway.domain.model.BrokerConfig;
import com.eryxon.gateway.domain.model.PublishOutcome;
import com.eryxon.gateway.domain.naming.TopicResolver;
import com.eryxon.gateway.infrastructure.config.GatewayProperties;
import com.eryxon.gateway.infrastructure.observability.GatewayMetrics;
import io.micrometer.observation.annotation.Observed;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Command handler that fans one domain event out to its subscribed brokers.
 *
 * Responsibilities:
 * - Validate the event before any broker is contacted
 * - Select the tenant's subscribed brokers
 * - Resolve each broker's topic and deliver to all brokers concurrently
 * - Wait for every delivery (each bounded by its own timeout) and record every outcome
 *
 * Per-broker failures never fail the call: delivery is best effort, at most once per broker.
 * Neither does a failure to write an outcome to the attempt log.
 */
@Slf4j
@Service
public class DispatchEventCommandHandler {

    private final SubscribedBrokerFinder brokerFinder;
    private final BrokerTransport brokerTransport;
    private final PublishOutcomeRecorder outcomeRecorder;
    private final GatewayMetrics metrics;
    private final Executor dispatchExecutor;
    private final long brokerTimeoutMs;

    public DispatchEventCommandHandler(
            SubscribedBrokerFinder brokerFinder,
            BrokerTransport brokerTransport,
            PublishOutcomeRecorder outcomeRecorder,
            GatewayMetrics metrics,
            @Qualifier("dispatchExecutor") Executor dispatchExecutor,
            GatewayProperties properties) {
        this.brokerFinder = brokerFinder;
        this.brokerTransport = brokerTransport;
        this.outcomeRecorder = outcomeRecorder;
        this.metrics = metrics;
        this.dispatchExecutor = dispatchExecutor;
        this.brokerTimeoutMs = properties.getDispatch().getBrokerTimeout().toMillis();
    }

    /**
     * Dispatches the event described by the command.
     *
     * @param command the event to dispatch
     * @return published/failed counts and one result per subscribed broker
     * @throws com.eryxon.gateway.domain.exception.ValidationException if tenant id, event type or data is missing
     */
    @Observed(name = "dispatch.handler", contextualName = "dispatch-event")
    public DispatchResult handle(DispatchEventCommand command) {
        EventEnvelope envelope = new EventEnvelope(
                command.getTenantId(),
                command.getEventType(),
                command.getData(),
                command.getContext(),
                null
        );
        envelope.validate();

        log.debug("Handling DispatchEventCommand: tenantId={}, eventType={}",
                envelope.getTenantId(), envelope.getEventType());
        metrics.recordEventReceived();

        return metrics.recordDispatchTime(() -> dispatch(envelope));
    }

    private DispatchResult dispatch(EventEnvelope envelope) {
        List<BrokerConfig> brokers = brokerFinder.findSubscribed(envelope.getTenantId(), envelope.getEventType());

        if (brokers.isEmpty()) {
            log.info("No active brokers subscribed: tenantId={}, eventType={}",
                    envelope.getTenantId(), envelope.getEventType());
            metrics.recordUnmatched();
            return DispatchResult.noMatchingBrokers(envelope.getEventType());
        }

        Map<String, Object> payload = envelope.toWirePayload();

        List<PendingDelivery> deliveries = new ArrayList<>(brokers.size());
        for (BrokerConfig broker : brokers) {
            deliveries.add(startDelivery(broker, envelope, payload));
        }

        CompletableFuture.allOf(deliveries.stream()
                .map(PendingDelivery::getFuture)
                .toArray(CompletableFuture[]::new))
                .join();

        List<BrokerDispatchResult> results = new ArrayList<>(deliveries.size());
        for (PendingDelivery delivery : deliveries) {
            PublishOutcome outcome = delivery.getFuture().join();
            BrokerConfig broker = delivery.getBroker();

            recordOutcome(broker, envelope.getEventType(), delivery.getTopic(), payload, outcome);
            metrics.recordPublish(outcome.isSuccess(), outcome.getLatencyMs());

            if (!outcome.isSuccess()) {
                log.warn("Broker delivery failed: brokerId={}, topic={}, latencyMs={}, error={}",
                        broker.getId(), delivery.getTopic(), outcome.getLatencyMs(), outcome.getError());
            }

            results.add(new BrokerDispatchResult(
                    broker.getId(),
                    delivery.getTopic(),
                    outcome.isSuccess(),
                    outcome.getError(),
                    outcome.getLatencyMs()
            ));
        }

        DispatchResult result = DispatchResult.of(results);
        log.info("Event dispatched: tenantId={}, eventType={}, published={}, failed={}",
                envelope.getTenantId(), envelope.getEventType(), result.getPublished(), result.getFailed());
        return result;
    }

    /**
     * Writes one outcome to the attempt log. A store failure only loses this broker's audit row;
     * the delivery itself already happened and the remaining brokers are still recorded.
     */
    private void recordOutcome(BrokerConfig broker, String eventType, String topic,
                               Map<String, Object> payload, PublishOutcome outcome) {
        try {
            outcomeRecorder.record(broker, eventType, topic, payload, outcome);
        } catch (StoreUnavailableException e) {
            log.error("Publish outcome not recorded: brokerId={}, topic={}, success={}",
                    broker.getId(), topic, outcome.isSuccess(), e);
            metrics.recordOutcomeNotRecorded();
        }
    }

    private PendingDelivery startDelivery(BrokerConfig broker, EventEnvelope envelope, Map<String, Object> payload) {
        String topic = TopicResolver.resolve(
                broker.getTopicPattern(),
                envelope.getContext(),
                broker.getDefaults(),
                envelope.getEventType(),
                envelope.getTenantId()
        );
        long startedAt = System.nanoTime();

        CompletableFuture<PublishOutcome> future;
        try {
            future = CompletableFuture
                    .supplyAsync(() -> brokerTransport.publish(broker, topic, payload), dispatchExecutor)
                    .completeOnTimeout(
                            PublishOutcome.failure("Delivery timed out after " + brokerTimeoutMs + " ms", brokerTimeoutMs),
                            brokerTimeoutMs,
                            TimeUnit.MILLISECONDS)
                    .exceptionally(ex -> PublishOutcome.failure(
                            "Delivery failed: " + describe(ex), elapsedMs(startedAt)));
        } catch (RejectedExecutionException e) {
            log.error("Dispatch pool saturated, delivery not attempted: brokerId={}", broker.getId(), e);
            future = CompletableFuture.completedFuture(PublishOutcome.failure(
                    "Dispatch pool saturated; delivery not attempted", elapsedMs(startedAt)));
        }

        return new PendingDelivery(broker, topic, future);
    }

    private static String describe(Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private static long elapsedMs(long startedAt) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
    }

    @Getter
    @AllArgsConstructor
    private static final class PendingDelivery {
        private final BrokerConfig broker;
        private final String topic;
        private final CompletableFuture<PublishOutcome> future;
    }
}
