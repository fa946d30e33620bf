package com.eryxon.gateway.infrastructure.persistence.repository;

import com.eryxon.gateway.infrastructure.persistence.entity.PublishAttemptEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * JPA repository for the publish attempt log.
 */
@Repository
public interface PublishAttemptJpaRepository extends JpaRepository<PublishAttemptEntity, UUID> {

    /**
     * Latest attempts of one broker, newest first. The page size bounds the result.
     */
    List<PublishAttemptEntity> findByBrokerIdOrderByCreatedAtDesc(UUID brokerId, Pageable pageable);
}
