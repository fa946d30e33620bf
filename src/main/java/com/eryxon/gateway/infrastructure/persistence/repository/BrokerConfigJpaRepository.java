package com.eryxon.gateway.infrastructure.persistence.repository;

import com.eryxon.gateway.infrastructure.persistence.entity.BrokerConfigEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * JPA repository for BrokerConfigEntity.
 *
 * The health updates are bulk UPDATE statements touching only the two health columns,
 * so a concurrent configuration edit is never overwritten by a stale entity.
 */
@Repository
public interface BrokerConfigJpaRepository extends JpaRepository<BrokerConfigEntity, UUID> {

    List<BrokerConfigEntity> findByTenantIdAndActiveTrue(String tenantId);

    List<BrokerConfigEntity> findByTenantIdOrderByNameAsc(String tenantId);

    long countByActiveTrue();

    long countByActiveTrueAndLastErrorIsNotNull();

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE BrokerConfigEntity b SET b.lastConnectedAt = :connectedAt, b.lastError = NULL WHERE b.id = :id")
    int markConnected(@Param("id") UUID id, @Param("connectedAt") Instant connectedAt);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE BrokerConfigEntity b SET b.lastError = :error WHERE b.id = :id")
    int markFailed(@Param("id") UUID id, @Param("error") String error);
}
