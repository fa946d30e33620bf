package com.eryxon.gateway.application.service;

import com.eryxon.gateway.domain.exception.StoreUnavailableException;
import com.eryxon.gateway.domain.model.BrokerConfig;
import com.eryxon.gateway.domain.model.PublishAttempt;
import com.eryxon.gateway.domain.model.PublishOutcome;
import com.eryxon.gateway.domain.repository.BrokerConfigRepository;
import com.eryxon.gateway.domain.repository.PublishAttemptRepository;
import com.eryxon.gateway.tags.UnitTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PublishOutcomeRecorder.
 * Every outcome produces exactly one attempt followed by one health update.
 */
@UnitTest
@ExtendWith(MockitoExtension.class)
class PublishOutcomeRecorderTest {

    private static final Instant NOW = Instant.parse("2025-03-01T09:00:00Z");

    @Mock
    private PublishAttemptRepository attemptRepository;

    @Mock
    private BrokerConfigRepository brokerConfigRepository;

    private PublishOutcomeRecorder recorder;

    private final BrokerConfig broker = BrokerConfig.builder()
            .id(UUID.randomUUID())
            .tenantId("t-1")
            .host("broker.example.com")
            .build();

    @BeforeEach
    void setUp() {
        recorder = new PublishOutcomeRecorder(attemptRepository, brokerConfigRepository,
                Clock.fixed(NOW, ZoneOffset.UTC));
        lenient().when(attemptRepository.append(any())).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    void shouldAppendAttemptAndMarkBrokerConnectedOnSuccess() {
        // When
        recorder.record(broker, "operation.started", "a/b", Map.of("event", "operation.started"),
                PublishOutcome.success(42));

        // Then
        ArgumentCaptor<PublishAttempt> captor = ArgumentCaptor.forClass(PublishAttempt.class);
        InOrder inOrder = inOrder(attemptRepository, brokerConfigRepository);
        inOrder.verify(attemptRepository).append(captor.capture());
        inOrder.verify(brokerConfigRepository).markConnected(broker.getId(), NOW);
        verify(brokerConfigRepository, never()).markFailed(any(), any());

        PublishAttempt attempt = captor.getValue();
        assertThat(attempt.getBrokerId()).isEqualTo(broker.getId());
        assertThat(attempt.getEventType()).isEqualTo("operation.started");
        assertThat(attempt.getTopic()).isEqualTo("a/b");
        assertThat(attempt.isSuccess()).isTrue();
        assertThat(attempt.getErrorMessage()).isNull();
        assertThat(attempt.getLatencyMs()).isEqualTo(42);
        assertThat(attempt.getPayload()).containsEntry("event", "operation.started");
    }

    @Test
    void shouldAppendAttemptAndStoreErrorOnFailure() {
        // When
        recorder.record(broker, "operation.started", "a/b", Map.of(), PublishOutcome.failure("HTTP 401", 7));

        // Then
        ArgumentCaptor<PublishAttempt> captor = ArgumentCaptor.forClass(PublishAttempt.class);
        verify(attemptRepository).append(captor.capture());
        verify(brokerConfigRepository).markFailed(broker.getId(), "HTTP 401");
        verify(brokerConfigRepository, never()).markConnected(any(), any());

        assertThat(captor.getValue().isSuccess()).isFalse();
        assertThat(captor.getValue().getErrorMessage()).isEqualTo("HTTP 401");
    }

    @Test
    void shouldPropagateStoreFailureWithoutTouchingHealthFields() {
        // Given
        when(attemptRepository.append(any())).thenThrow(new StoreUnavailableException("down"));

        // When/Then
        assertThatThrownBy(() -> recorder.record(broker, "operation.started", "a/b", Map.of(),
                PublishOutcome.success(1)))
                .isInstanceOf(StoreUnavailableException.class);

        verifyNoInteractions(brokerConfigRepository);
    }
}
