package com.eryxon.gateway.infrastructure.resilience;

import com.eryxon.gateway.infrastructure.config.GatewayProperties;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the per-broker circuit breakers.
 * Every broker gets its own breaker from the shared registry, so one unreachable broker
 * fails fast without affecting deliveries to the tenant's other brokers.
 *
 * Circuit Breaker States:
 * - CLOSED: Normal operation, deliveries reach the broker
 * - OPEN: Failure threshold exceeded, deliveries fail fast with a recorded failure
 * - HALF_OPEN: Testing if the broker recovered, limited deliveries allowed
 */
@Configuration
public class CircuitBreakerConfiguration {

    /**
     * Builds the breaker settings from {@code gateway.transport.circuit-breaker.*}.
     *
     * @param properties gateway settings
     * @return CircuitBreakerConfig shared by all broker breakers
     */
    @Bean
    public CircuitBreakerConfig brokerCircuitBreakerConfig(GatewayProperties properties) {
        GatewayProperties.CircuitBreaker settings = properties.getTransport().getCircuitBreaker();
        return CircuitBreakerConfig.custom()
            .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(settings.getSlidingWindowSize())
            .minimumNumberOfCalls(settings.getSlidingWindowSize())
            .failureRateThreshold(settings.getFailureRateThreshold())
            .waitDurationInOpenState(settings.getWaitDurationInOpenState())
            .permittedNumberOfCallsInHalfOpenState(settings.getPermittedCallsInHalfOpenState())
            .automaticTransitionFromOpenToHalfOpenEnabled(true)
            .build();
    }

    /**
     * Creates the registry that hands out one breaker per broker id.
     *
     * @param config the circuit breaker configuration
     * @return CircuitBreakerRegistry instance
     */
    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(CircuitBreakerConfig config) {
        return CircuitBreakerRegistry.of(config);
    }
}
