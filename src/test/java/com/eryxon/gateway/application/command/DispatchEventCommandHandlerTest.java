package com.eryxon.gateway.application.command;

import com.eryxon.gateway.application.port.BrokerTransport;
import com.eryxon.gateway.application.service.PublishOutcomeRecorder;
import com.eryxon.gateway.application.service.SubscribedBrokerFinder;
import com.eryxon.gateway.domain.event.EventContext;
import com.eryxon.gateway.domain.exception.StoreUnavailableException;
import com.eryxon.gateway.domain.exception.ValidationException;
import com.eryxon.gateway.domain.model.BrokerConfig;
import com.eryxon.gateway.domain.model.HierarchyDefaults;
import com.eryxon.gateway.domain.model.PublishOutcome;
import com.eryxon.gateway.infrastructure.config.GatewayProperties;
import com.eryxon.gateway.infrastructure.observability.GatewayMetrics;
import com.eryxon.gateway.tags.UnitTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for DispatchEventCommandHandler.
 * Tests validation, broker selection, concurrent delivery, timeouts and outcome recording.
 */
@UnitTest
@ExtendWith(MockitoExtension.class)
class DispatchEventCommandHandlerTest {

    private static final String TENANT = "t-1";
    private static final String EVENT = "operation.started";

    @Mock
    private SubscribedBrokerFinder brokerFinder;

    @Mock
    private BrokerTransport brokerTransport;

    @Mock
    private PublishOutcomeRecorder outcomeRecorder;

    @Mock
    private GatewayMetrics metrics;

    @Captor
    private ArgumentCaptor<Map<String, Object>> payloads;

    private GatewayProperties properties;

    private DispatchEventCommandHandler handler;

    @BeforeEach
    void setUp() {
        lenient().when(metrics.recordDispatchTime(any())).thenAnswer(invocation -> {
            Supplier<?> operation = invocation.getArgument(0);
            return operation.get();
        });

        properties = new GatewayProperties();
        handler = new DispatchEventCommandHandler(brokerFinder, brokerTransport, outcomeRecorder, metrics,
                Runnable::run, properties);
    }

    @Test
    void shouldReturnZeroCountsWhenNoBrokerSubscribed() {
        // Given
        when(brokerFinder.findSubscribed(TENANT, EVENT)).thenReturn(List.of());

        // When
        DispatchResult result = handler.handle(command(Map.of("id", 1)));

        // Then
        assertThat(result.getPublished()).isZero();
        assertThat(result.getFailed()).isZero();
        assertThat(result.getResults()).isEmpty();
        assertThat(result.getMessage()).isEqualTo("No active brokers subscribed to operation.started");
        verifyNoInteractions(brokerTransport, outcomeRecorder);
        verify(metrics).recordUnmatched();
    }

    @Test
    void shouldDeliverToEveryBrokerAndRecordEachOutcome() {
        // Given
        BrokerConfig healthy = broker("{site}/{event}", new HierarchyDefaults(null, "Plant A", null));
        BrokerConfig failing = broker("{tenant_id}/{event}", HierarchyDefaults.none());
        when(brokerFinder.findSubscribed(TENANT, EVENT)).thenReturn(List.of(healthy, failing));
        when(brokerTransport.publish(eq(healthy), anyString(), any())).thenReturn(PublishOutcome.success(15));
        when(brokerTransport.publish(eq(failing), anyString(), any()))
                .thenReturn(PublishOutcome.failure("HTTP 503", 40));

        // When
        DispatchResult result = handler.handle(command(Map.of("operation_id", "op-1")));

        // Then
        assertThat(result.getPublished()).isEqualTo(1);
        assertThat(result.getFailed()).isEqualTo(1);
        assertThat(result.getMessage()).isEqualTo("Published to 1 of 2 broker(s)");
        assertThat(result.getResults())
                .extracting(BrokerDispatchResult::getBrokerId, BrokerDispatchResult::getTopic,
                        BrokerDispatchResult::isSuccess, BrokerDispatchResult::getError)
                .containsExactlyInAnyOrder(
                        tuple(healthy.getId(), "plant_a/operation/started", true, null),
                        tuple(failing.getId(), "t-1/operation/started", false, "HTTP 503"));

        verify(outcomeRecorder).record(eq(healthy), eq(EVENT), eq("plant_a/operation/started"), any(),
                eq(PublishOutcome.success(15)));
        verify(outcomeRecorder).record(eq(failing), eq(EVENT), eq("t-1/operation/started"), any(),
                eq(PublishOutcome.failure("HTTP 503", 40)));
        verify(metrics).recordPublish(true, 15);
        verify(metrics).recordPublish(false, 40);
    }

    @Test
    void shouldSendTheSameWirePayloadToEveryBroker() {
        // Given
        BrokerConfig first = broker(null, null);
        BrokerConfig second = broker(null, null);
        when(brokerFinder.findSubscribed(TENANT, EVENT)).thenReturn(List.of(first, second));
        when(brokerTransport.publish(any(), anyString(), any())).thenReturn(PublishOutcome.success(1));

        // When
        handler.handle(command(Map.of("operation_id", "op-1")));

        // Then
        verify(brokerTransport, times(2)).publish(any(), anyString(), payloads.capture());
        assertThat(payloads.getAllValues()).allSatisfy(payload -> {
            assertThat(payload).containsEntry("event", EVENT);
            assertThat(payload).containsEntry("tenant_id", TENANT);
            assertThat(payload).containsEntry("data", Map.of("operation_id", "op-1"));
            assertThat(payload).containsKey("timestamp");
        });
    }

    @Test
    void shouldKeepRecordingOtherBrokersWhenAttemptLogWriteFails() {
        // Given
        BrokerConfig first = broker(null, null);
        BrokerConfig second = broker(null, null);
        when(brokerFinder.findSubscribed(TENANT, EVENT)).thenReturn(List.of(first, second));
        when(brokerTransport.publish(any(), anyString(), any())).thenReturn(PublishOutcome.success(3));
        doThrow(new StoreUnavailableException("Publish attempt store unavailable"))
                .when(outcomeRecorder).record(eq(first), any(), any(), any(), any());

        // When
        DispatchResult result = handler.handle(command(Map.of("operation_id", "op-1")));

        // Then
        assertThat(result.getPublished()).isEqualTo(2);
        assertThat(result.getFailed()).isZero();
        assertThat(result.getResults()).extracting(BrokerDispatchResult::getBrokerId)
                .containsExactlyInAnyOrder(first.getId(), second.getId());
        verify(outcomeRecorder).record(eq(first), eq(EVENT), anyString(), any(), any());
        verify(outcomeRecorder).record(eq(second), eq(EVENT), anyString(), any(), any());
        verify(metrics).recordOutcomeNotRecorded();
        verify(metrics, times(2)).recordPublish(true, 3);
    }

    @Test
    void shouldRejectInvalidEventBeforeContactingAnyBroker() {
        // Given
        DispatchEventCommand command = new DispatchEventCommand(TENANT, EVENT, null, null);

        // When/Then
        assertThatThrownBy(() -> handler.handle(command))
                .isInstanceOf(ValidationException.class)
                .hasMessage("data is required");

        verifyNoInteractions(brokerFinder, brokerTransport, outcomeRecorder);
        verify(metrics, never()).recordEventReceived();
    }

    @Test
    void shouldRejectMissingTenant() {
        DispatchEventCommand command = new DispatchEventCommand(null, EVENT, Map.of(), null);

        assertThatThrownBy(() -> handler.handle(command))
                .isInstanceOf(ValidationException.class)
                .hasMessage("tenant_id is required");

        verifyNoInteractions(brokerFinder, brokerTransport, outcomeRecorder);
    }

    @Test
    void shouldTurnTransportExceptionIntoRecordedFailure() {
        // Given
        BrokerConfig broker = broker(null, null);
        when(brokerFinder.findSubscribed(TENANT, EVENT)).thenReturn(List.of(broker));
        when(brokerTransport.publish(any(), anyString(), any())).thenThrow(new IllegalStateException("boom"));

        // When
        DispatchResult result = handler.handle(command(Map.of()));

        // Then
        assertThat(result.getFailed()).isEqualTo(1);
        assertThat(result.getResults().get(0).getError()).isEqualTo("Delivery failed: boom");
        verify(outcomeRecorder).record(eq(broker), eq(EVENT), anyString(), any(),
                argThat(outcome -> !outcome.isSuccess()));
    }

    @Test
    void shouldTimeOutSlowBrokerWithoutDelayingOthers() throws Exception {
        // Given
        properties.getDispatch().setBrokerTimeout(Duration.ofMillis(300));
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch release = new CountDownLatch(1);
        try {
            handler = new DispatchEventCommandHandler(brokerFinder, brokerTransport, outcomeRecorder, metrics,
                    executor, properties);

            BrokerConfig slow = broker(null, null);
            BrokerConfig fast = broker(null, null);
            when(brokerFinder.findSubscribed(TENANT, EVENT)).thenReturn(List.of(slow, fast));
            when(brokerTransport.publish(eq(slow), anyString(), any())).thenAnswer(invocation -> {
                release.await(5, TimeUnit.SECONDS);
                return PublishOutcome.success(5000);
            });
            when(brokerTransport.publish(eq(fast), anyString(), any())).thenReturn(PublishOutcome.success(3));

            // When
            long startedAt = System.nanoTime();
            DispatchResult result = handler.handle(command(Map.of()));
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);

            // Then
            assertThat(elapsedMs).isLessThan(3000);
            assertThat(result.getPublished()).isEqualTo(1);
            assertThat(result.getFailed()).isEqualTo(1);
            BrokerDispatchResult timedOut = result.getResults().stream()
                    .filter(r -> r.getBrokerId().equals(slow.getId()))
                    .findFirst()
                    .orElseThrow();
            assertThat(timedOut.getError()).isEqualTo("Delivery timed out after 300 ms");
            verify(outcomeRecorder, times(2)).record(any(), eq(EVENT), anyString(), any(), any());
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    void shouldRecordFailureWhenDispatchPoolRejectsTask() {
        // Given
        handler = new DispatchEventCommandHandler(brokerFinder, brokerTransport, outcomeRecorder, metrics,
                task -> {
                    throw new RejectedExecutionException("full");
                }, properties);
        BrokerConfig broker = broker(null, null);
        when(brokerFinder.findSubscribed(TENANT, EVENT)).thenReturn(List.of(broker));

        // When
        DispatchResult result = handler.handle(command(Map.of()));

        // Then
        assertThat(result.getFailed()).isEqualTo(1);
        assertThat(result.getResults().get(0).getError())
                .isEqualTo("Dispatch pool saturated; delivery not attempted");
        verifyNoInteractions(brokerTransport);
        verify(metrics).recordPublish(eq(false), anyLong());
        verify(metrics, never()).recordPublish(eq(true), anyLong());
        verify(outcomeRecorder).record(eq(broker), eq(EVENT), anyString(), any(), any());
        verify(metrics, never()).recordUnmatched();
        verify(metrics).recordEventReceived();
        verifyNoMoreInteractions(outcomeRecorder);
    }

    private static DispatchEventCommand command(Map<String, Object> data) {
        return new DispatchEventCommand(TENANT, EVENT, data, EventContext.empty());
    }

    private static BrokerConfig broker(String pattern, HierarchyDefaults defaults) {
        return BrokerConfig.builder()
                .id(UUID.randomUUID())
                .tenantId(TENANT)
                .name("broker")
                .host("broker.example.com")
                .port(8883)
                .topicPattern(pattern)
                .defaults(defaults)
                .subscribedEvents(Set.of(EVENT))
                .active(true)
                .build();
    }
}
