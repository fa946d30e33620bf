package com.eryxon.gateway.infrastructure.persistence.repository;

import com.eryxon.gateway.domain.exception.StoreUnavailableException;
import com.eryxon.gateway.domain.model.BrokerConfig;
import com.eryxon.gateway.domain.model.HierarchyDefaults;
import com.eryxon.gateway.domain.repository.BrokerConfigRepository;
import com.eryxon.gateway.infrastructure.persistence.entity.BrokerConfigEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * JPA adapter for BrokerConfigRepository that adapts the domain interface
 * to the JPA infrastructure layer.
 *
 * Maps between the domain BrokerConfig and BrokerConfigEntity, and translates
 * Spring data access failures into StoreUnavailableException.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaBrokerConfigRepositoryAdapter implements BrokerConfigRepository {

    private final BrokerConfigJpaRepository jpaRepository;

    @Override
    public List<BrokerConfig> findActiveByTenant(String tenantId) {
        if (tenantId == null) {
            throw new IllegalArgumentException("TenantId cannot be null");
        }

        return execute("find active brokers", () -> jpaRepository.findByTenantIdAndActiveTrue(tenantId).stream()
                .map(this::toDomain)
                .collect(Collectors.toList()));
    }

    @Override
    public List<BrokerConfig> findAllByTenant(String tenantId) {
        if (tenantId == null) {
            throw new IllegalArgumentException("TenantId cannot be null");
        }

        return execute("find tenant brokers", () -> jpaRepository.findByTenantIdOrderByNameAsc(tenantId).stream()
                .map(this::toDomain)
                .collect(Collectors.toList()));
    }

    @Override
    public Optional<BrokerConfig> findById(UUID brokerId) {
        if (brokerId == null) {
            throw new IllegalArgumentException("BrokerId cannot be null");
        }

        return execute("find broker", () -> jpaRepository.findById(brokerId).map(this::toDomain));
    }

    @Override
    public void markConnected(UUID brokerId, Instant connectedAt) {
        int updated = execute("mark broker connected", () -> jpaRepository.markConnected(brokerId, connectedAt));
        if (updated == 0) {
            log.warn("Broker vanished before health update: brokerId={}", brokerId);
        }
    }

    @Override
    public void markFailed(UUID brokerId, String error) {
        int updated = execute("mark broker failed", () -> jpaRepository.markFailed(brokerId, error));
        if (updated == 0) {
            log.warn("Broker vanished before health update: brokerId={}", brokerId);
        }
    }

    @Override
    public long countActive() {
        return execute("count active brokers", jpaRepository::countByActiveTrue);
    }

    @Override
    public long countActiveWithError() {
        return execute("count failing brokers", jpaRepository::countByActiveTrueAndLastErrorIsNotNull);
    }

    private <T> T execute(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            log.error("Broker config store failure: operation={}", operation, e);
            throw new StoreUnavailableException("Broker config store unavailable: " + operation, e);
        }
    }

    /**
     * Maps a BrokerConfigEntity to the domain BrokerConfig.
     *
     * @param entity the JPA entity
     * @return the corresponding domain model
     */
    private BrokerConfig toDomain(BrokerConfigEntity entity) {
        return BrokerConfig.builder()
                .id(entity.getId())
                .tenantId(entity.getTenantId())
                .name(entity.getName())
                .host(entity.getBrokerUrl())
                .port(entity.getPort())
                .username(entity.getUsername())
                .password(entity.getPassword())
                .topicPattern(entity.getTopicPattern())
                .defaults(new HierarchyDefaults(
                        entity.getDefaultEnterprise(),
                        entity.getDefaultSite(),
                        entity.getDefaultArea()))
                .useTls(entity.isUseTls())
                .subscribedEvents(entity.getSubscribedEvents())
                .active(entity.isActive())
                .transportKind(entity.getTransportKind())
                .lastConnectedAt(entity.getLastConnectedAt())
                .lastError(entity.getLastError())
                .build();
    }
}
