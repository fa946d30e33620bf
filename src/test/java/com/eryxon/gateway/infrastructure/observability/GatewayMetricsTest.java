package com.eryxon.gateway.infrastructure.observability;

import com.eryxon.gateway.tags.UnitTest;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for GatewayMetrics.
 * Tests counter increments, timer recording and metric names.
 */
@UnitTest
class GatewayMetricsTest {

    private MeterRegistry meterRegistry;
    private GatewayMetrics gatewayMetrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        gatewayMetrics = new GatewayMetrics(meterRegistry);
    }

    @Test
    void shouldIncrementEventsReceivedCounter() {
        // Given
        Counter counter = meterRegistry.find("gateway.events.received.total").counter();
        assertThat(counter).isNotNull();

        // When
        gatewayMetrics.recordEventReceived();

        // Then
        assertThat(counter.count()).isEqualTo(1.0);
    }

    @Test
    void shouldIncrementUnmatchedCounter() {
        gatewayMetrics.recordUnmatched();
        gatewayMetrics.recordUnmatched();

        assertThat(meterRegistry.find("gateway.events.unmatched.total").counter().count()).isEqualTo(2.0);
    }

    @Test
    void shouldSplitPublishOutcomesAndRecordLatency() {
        // When
        gatewayMetrics.recordPublish(true, 120);
        gatewayMetrics.recordPublish(false, 80);
        gatewayMetrics.recordPublish(true, 40);

        // Then
        assertThat(meterRegistry.find("gateway.publish.success.total").counter().count()).isEqualTo(2.0);
        assertThat(meterRegistry.find("gateway.publish.failure.total").counter().count()).isEqualTo(1.0);

        Timer latency = meterRegistry.find("gateway.publish.latency").timer();
        assertThat(latency).isNotNull();
        assertThat(latency.count()).isEqualTo(3);
        assertThat(latency.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(240.0);
    }

    @Test
    void shouldCountOutcomesMissingFromAttemptLog() {
        gatewayMetrics.recordOutcomeNotRecorded();

        assertThat(meterRegistry.find("gateway.record.failure.total").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldCountCircuitRejectionsAndDeadLetters() {
        gatewayMetrics.recordCircuitRejected();
        gatewayMetrics.recordDlqMessageSent();

        assertThat(meterRegistry.find("gateway.circuit.rejected.total").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.find("gateway.kafka.dlq.total").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldTimeDispatchAndReturnItsResult() {
        // When
        String result = gatewayMetrics.recordDispatchTime(() -> "done");

        // Then
        assertThat(result).isEqualTo("done");
        assertThat(meterRegistry.find("gateway.dispatch.time").timer().count()).isEqualTo(1);
    }
}
