package com.eryxon.gateway.domain.repository;

import com.eryxon.gateway.domain.model.BrokerConfig;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for tenant-scoped broker configurations.
 * Configurations are maintained by tenant administrators elsewhere; the gateway only reads them
 * and writes the two health fields.
 */
public interface BrokerConfigRepository {

    /**
     * Lists the enabled brokers of one tenant.
     *
     * @param tenantId the owning tenant
     * @return active brokers of that tenant, or an empty list
     * @throws IllegalArgumentException if tenantId is null
     */
    List<BrokerConfig> findActiveByTenant(String tenantId);

    /**
     * Lists every broker of one tenant, enabled or not.
     *
     * @param tenantId the owning tenant
     * @return the tenant's brokers, or an empty list
     */
    List<BrokerConfig> findAllByTenant(String tenantId);

    Optional<BrokerConfig> findById(UUID brokerId);

    /**
     * Records a successful delivery: sets last_connected_at and clears last_error.
     */
    void markConnected(UUID brokerId, Instant connectedAt);

    /**
     * Records a failed delivery: sets last_error and leaves last_connected_at untouched.
     */
    void markFailed(UUID brokerId, String error);

    /**
     * @return number of enabled brokers across all tenants
     */
    long countActive();

    /**
     * @return number of enabled brokers whose most recent delivery left an error
     */
    long countActiveWithError();
}
