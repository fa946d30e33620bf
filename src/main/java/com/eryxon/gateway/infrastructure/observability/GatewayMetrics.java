package com.eryxon.gateway.infrastructure.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Counters and timers for the publishing gateway.
 */
@Slf4j
@Component
public class GatewayMetrics {

    private final Counter eventsReceived;
    private final Counter eventsUnmatched;
    private final Counter publishSuccess;
    private final Counter publishFailure;
    private final Counter circuitRejected;
    private final Counter dlqMessages;
    private final Counter recordFailures;
    private final Timer dispatchTime;
    private final Timer publishLatency;

    public GatewayMetrics(MeterRegistry registry) {
        this.eventsReceived = Counter.builder("gateway.events.received.total")
                .description("Total events accepted for dispatch")
                .register(registry);

        this.eventsUnmatched = Counter.builder("gateway.events.unmatched.total")
                .description("Events no active broker subscribed to")
                .register(registry);

        this.publishSuccess = Counter.builder("gateway.publish.success.total")
                .description("Broker deliveries that succeeded")
                .register(registry);

        this.publishFailure = Counter.builder("gateway.publish.failure.total")
                .description("Broker deliveries that failed")
                .register(registry);

        this.circuitRejected = Counter.builder("gateway.circuit.rejected.total")
                .description("Deliveries skipped because the broker's circuit breaker was open")
                .register(registry);

        this.dlqMessages = Counter.builder("gateway.kafka.dlq.total")
                .description("Inbound Kafka events sent to the dead letter topic")
                .register(registry);

        this.recordFailures = Counter.builder("gateway.record.failure.total")
                .description("Delivery outcomes that could not be written to the attempt log")
                .register(registry);

        this.dispatchTime = Timer.builder("gateway.dispatch.time")
                .description("Time to fan one event out to all subscribed brokers")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        this.publishLatency = Timer.builder("gateway.publish.latency")
                .description("Latency of a single broker delivery")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordEventReceived() {
        eventsReceived.increment();
    }

    public void recordUnmatched() {
        eventsUnmatched.increment();
        log.debug("Unmatched event counter incremented");
    }

    /**
     * Counts one broker delivery and records its latency.
     */
    public void recordPublish(boolean success, long latencyMs) {
        if (success) {
            publishSuccess.increment();
        } else {
            publishFailure.increment();
        }
        publishLatency.record(Duration.ofMillis(latencyMs));
    }

    public void recordCircuitRejected() {
        circuitRejected.increment();
    }

    public void recordOutcomeNotRecorded() {
        recordFailures.increment();
    }

    public void recordDlqMessageSent() {
        dlqMessages.increment();
        log.debug("DLQ counter incremented");
    }

    /**
     * Times a full dispatch call.
     *
     * @param operation the dispatch to time
     * @param <T> the dispatch result type
     * @return the result of the operation
     */
    public <T> T recordDispatchTime(Supplier<T> operation) {
        return dispatchTime.record(operation);
    }
}
