package com.eryxon.gateway.infrastructure.resilience;

import com.eryxon.gateway.application.port.BrokerTransport;
import com.eryxon.gateway.domain.model.BrokerConfig;
import com.eryxon.gateway.domain.model.PublishOutcome;
import com.eryxon.gateway.infrastructure.config.GatewayProperties;
import com.eryxon.gateway.infrastructure.observability.GatewayMetrics;
import com.eryxon.gateway.infrastructure.transport.HttpBridgeBrokerTransport;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Circuit breaker decorator around the HTTP bridge transport.
 *
 * Features:
 * - One breaker per broker, named {@code broker-<id>}
 * - An open breaker short-circuits the delivery into a failure outcome, which is still recorded
 * - Logs circuit breaker state changes for observability
 *
 * The delegate never throws for delivery problems, so failures are reported to the breaker
 * explicitly from the returned outcome.
 *
 * Disabled unless {@code gateway.transport.circuit-breaker.enabled=true}; when disabled every call
 * goes straight to the delegate.
 */
@Slf4j
@Primary
@Component
public class ResilientBrokerTransport implements BrokerTransport {

    static final String BREAKER_PREFIX = "broker-";

    private final BrokerTransport delegate;
    private final CircuitBreakerRegistry registry;
    private final GatewayMetrics metrics;
    private final boolean enabled;

    @Autowired
    public ResilientBrokerTransport(
            HttpBridgeBrokerTransport delegate,
            CircuitBreakerRegistry registry,
            GatewayMetrics metrics,
            GatewayProperties properties) {
        this(delegate, registry, metrics, properties.getTransport().getCircuitBreaker().isEnabled());
    }

    ResilientBrokerTransport(
            BrokerTransport delegate,
            CircuitBreakerRegistry registry,
            GatewayMetrics metrics,
            boolean enabled) {
        this.delegate = delegate;
        this.registry = registry;
        this.metrics = metrics;
        this.enabled = enabled;

        registerCircuitBreakerEventListeners();
    }

    @Override
    public PublishOutcome publish(BrokerConfig broker, String topic, Map<String, Object> payload) {
        if (!enabled) {
            return delegate.publish(broker, topic, payload);
        }

        CircuitBreaker circuitBreaker = registry.circuitBreaker(BREAKER_PREFIX + broker.getId());
        if (!circuitBreaker.tryAcquirePermission()) {
            log.warn("Circuit breaker is OPEN, skipping delivery: brokerId={}, topic={}", broker.getId(), topic);
            metrics.recordCircuitRejected();
            return PublishOutcome.failure(
                    "Circuit breaker open for broker " + broker.getId() + "; delivery not attempted", 0);
        }

        long startedAt = System.nanoTime();
        PublishOutcome outcome;
        try {
            outcome = delegate.publish(broker, topic, payload);
        } catch (RuntimeException e) {
            circuitBreaker.onError(System.nanoTime() - startedAt, TimeUnit.NANOSECONDS, e);
            throw e;
        }

        long duration = System.nanoTime() - startedAt;
        if (outcome.isSuccess()) {
            circuitBreaker.onSuccess(duration, TimeUnit.NANOSECONDS);
        } else {
            circuitBreaker.onError(duration, TimeUnit.NANOSECONDS, new DeliveryFailedException(outcome.getError()));
        }
        return outcome;
    }

    /**
     * Attaches state-transition logging to every breaker the registry creates.
     */
    private void registerCircuitBreakerEventListeners() {
        registry.getEventPublisher().onEntryAdded(added -> {
            CircuitBreaker circuitBreaker = added.getAddedEntry();
            circuitBreaker.getEventPublisher()
                    .onStateTransition(event -> log.warn(
                            "Circuit breaker state transition: name={}, {} -> {} (failure rate: {}%)",
                            circuitBreaker.getName(),
                            event.getStateTransition().getFromState(),
                            event.getStateTransition().getToState(),
                            circuitBreaker.getMetrics().getFailureRate()))
                    .onCallNotPermitted(event -> log.debug(
                            "Circuit breaker call not permitted: name={}", circuitBreaker.getName()));
        });
    }

    /**
     * Carries a failed outcome into the breaker's failure statistics.
     */
    static final class DeliveryFailedException extends RuntimeException {

        DeliveryFailedException(String message) {
            super(message);
        }
    }
}
