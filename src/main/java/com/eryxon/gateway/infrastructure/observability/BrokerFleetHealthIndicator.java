package com.eryxon.gateway.infrastructure.observability;

import com.eryxon.gateway.domain.repository.BrokerConfigRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports how many active brokers are currently failing.
 *
 * Broker failures are expected in a best-effort gateway, so the status stays UP while any
 * broker is reachable; it only turns DOWN when every active broker has a recorded error.
 * A fleet with no active brokers is UP.
 */
@Slf4j
@Component("brokerFleet")
@RequiredArgsConstructor
public class BrokerFleetHealthIndicator implements HealthIndicator {

    private final BrokerConfigRepository brokerConfigRepository;

    @Override
    public Health health() {
        try {
            long active = brokerConfigRepository.countActive();
            long failing = brokerConfigRepository.countActiveWithError();

            Health.Builder builder = active > 0 && failing == active ? Health.down() : Health.up();
            return builder
                    .withDetail("activeBrokers", active)
                    .withDetail("failingBrokers", failing)
                    .build();

        } catch (Exception e) {
            log.error("Broker fleet health check failed", e);
            return Health.unknown()
                    .withDetail("error", e.getClass().getSimpleName())
                    .withDetail("message", e.getMessage())
                    .build();
        }
    }
}
