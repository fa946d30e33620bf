package com.eryxon.gateway.application.query;

import com.eryxon.gateway.domain.exception.ValidationException;
import com.eryxon.gateway.domain.model.BrokerConfig;
import com.eryxon.gateway.domain.model.BrokerHealth;
import com.eryxon.gateway.domain.repository.BrokerConfigRepository;
import com.eryxon.gateway.domain.repository.PublishAttemptRepository;
import com.eryxon.gateway.infrastructure.config.GatewayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Query handler that derives each broker's health from its recent publish attempts.
 *
 * Responsibilities:
 * - List all brokers of the tenant, active or not
 * - Read the latest attempts of each broker (bounded by the configured sample size)
 * - Classify the broker as HEALTHY, DEGRADED or UNKNOWN
 */
@Slf4j
@Service
public class GetBrokerHealthQueryHandler {

    private final BrokerConfigRepository brokerConfigRepository;
    private final PublishAttemptRepository attemptRepository;
    private final int sampleSize;

    public GetBrokerHealthQueryHandler(
            BrokerConfigRepository brokerConfigRepository,
            PublishAttemptRepository attemptRepository,
            GatewayProperties properties) {
        this.brokerConfigRepository = brokerConfigRepository;
        this.attemptRepository = attemptRepository;
        this.sampleSize = properties.getHealth().getSampleSize();
    }

    /**
     * @param query the tenant to report on
     * @return one entry per broker, an empty list when the tenant has none
     * @throws ValidationException if the tenant id is blank
     */
    public List<BrokerHealthResponse> handle(GetBrokerHealthQuery query) {
        if (query.getTenantId() == null || query.getTenantId().isBlank()) {
            throw new ValidationException("tenant_id is required");
        }

        List<BrokerHealthResponse> health = brokerConfigRepository.findAllByTenant(query.getTenantId()).stream()
                .map(this::describe)
                .collect(Collectors.toList());

        log.debug("Broker health computed: tenantId={}, brokers={}", query.getTenantId(), health.size());
        return health;
    }

    private BrokerHealthResponse describe(BrokerConfig broker) {
        BrokerHealth health = BrokerHealth.from(broker, attemptRepository.findRecentByBroker(broker.getId(), sampleSize));
        return new BrokerHealthResponse(
                broker.getId(),
                broker.getName(),
                broker.isActive(),
                broker.getTransportKind(),
                health.getStatus(),
                health.getSampleSize(),
                health.getSuccessCount(),
                health.getSuccessRate(),
                health.getLastAttemptAt(),
                health.getLastConnectedAt(),
                health.getLastError()
        );
    }
}
