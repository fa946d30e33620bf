package com.eryxon.gateway.infrastructure.observability;

import com.eryxon.gateway.domain.exception.StoreUnavailableException;
import com.eryxon.gateway.domain.repository.BrokerConfigRepository;
import com.eryxon.gateway.tags.UnitTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

/**
 * Unit tests for BrokerFleetHealthIndicator.
 */
@UnitTest
@ExtendWith(MockitoExtension.class)
class BrokerFleetHealthIndicatorTest {

    @Mock
    private BrokerConfigRepository brokerConfigRepository;

    private BrokerFleetHealthIndicator healthIndicator;

    @BeforeEach
    void setUp() {
        healthIndicator = new BrokerFleetHealthIndicator(brokerConfigRepository);
    }

    @Test
    void shouldStayUpWhileSomeBrokersWork() {
        when(brokerConfigRepository.countActive()).thenReturn(3L);
        when(brokerConfigRepository.countActiveWithError()).thenReturn(2L);

        Health health = healthIndicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("activeBrokers", 3L)
                .containsEntry("failingBrokers", 2L);
    }

    @Test
    void shouldBeDownWhenEveryActiveBrokerFails() {
        when(brokerConfigRepository.countActive()).thenReturn(2L);
        when(brokerConfigRepository.countActiveWithError()).thenReturn(2L);

        assertThat(healthIndicator.health().getStatus()).isEqualTo(Status.DOWN);
    }

    @Test
    void shouldBeUpWithoutActiveBrokers() {
        when(brokerConfigRepository.countActive()).thenReturn(0L);
        when(brokerConfigRepository.countActiveWithError()).thenReturn(0L);

        assertThat(healthIndicator.health().getStatus()).isEqualTo(Status.UP);
    }

    @Test
    void shouldBeUnknownWhenStoreIsUnreachable() {
        when(brokerConfigRepository.countActive())
                .thenThrow(new StoreUnavailableException("Failed to count brokers"));

        Health health = healthIndicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UNKNOWN);
        assertThat(health.getDetails()).containsEntry("error", "StoreUnavailableException");
    }
}
