package com.eryxon.gateway.infrastructure.persistence.repository;

import com.eryxon.gateway.domain.exception.StoreUnavailableException;
import com.eryxon.gateway.domain.model.PublishAttempt;
import com.eryxon.gateway.domain.repository.PublishAttemptRepository;
import com.eryxon.gateway.infrastructure.persistence.entity.PublishAttemptEntity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * JPA adapter for PublishAttemptRepository.
 * Payloads are stored as JSON text; there is no update or delete path.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaPublishAttemptRepositoryAdapter implements PublishAttemptRepository {

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final PublishAttemptJpaRepository jpaRepository;
    private final ObjectMapper objectMapper;

    /**
     * Persists a publish attempt.
     *
     * @param attempt the attempt to append
     * @return the stored attempt with id and creation time assigned
     * @throws IllegalArgumentException if attempt is null
     * @throws StoreUnavailableException if the database rejects the insert
     */
    @Override
    public PublishAttempt append(PublishAttempt attempt) {
        if (attempt == null) {
            throw new IllegalArgumentException("PublishAttempt cannot be null");
        }

        try {
            return toDomain(jpaRepository.save(toEntity(attempt)));
        } catch (DataAccessException e) {
            log.error("Failed to append publish attempt: brokerId={}, eventType={}",
                    attempt.getBrokerId(), attempt.getEventType(), e);
            throw new StoreUnavailableException("Publish attempt store unavailable", e);
        }
    }

    @Override
    public List<PublishAttempt> findRecentByBroker(UUID brokerId, int limit) {
        if (brokerId == null) {
            throw new IllegalArgumentException("BrokerId cannot be null");
        }
        if (limit <= 0) {
            return Collections.emptyList();
        }

        try {
            return jpaRepository.findByBrokerIdOrderByCreatedAtDesc(brokerId, PageRequest.of(0, limit)).stream()
                    .map(this::toDomain)
                    .collect(Collectors.toList());
        } catch (DataAccessException e) {
            log.error("Failed to read publish attempts: brokerId={}", brokerId, e);
            throw new StoreUnavailableException("Publish attempt store unavailable", e);
        }
    }

    private PublishAttemptEntity toEntity(PublishAttempt attempt) {
        return new PublishAttemptEntity(
                attempt.getId(),
                attempt.getBrokerId(),
                attempt.getEventType(),
                attempt.getTopic(),
                writePayload(attempt.getPayload()),
                attempt.isSuccess(),
                attempt.getErrorMessage(),
                attempt.getLatencyMs(),
                attempt.getCreatedAt()
        );
    }

    private PublishAttempt toDomain(PublishAttemptEntity entity) {
        return new PublishAttempt(
                entity.getId(),
                entity.getBrokerId(),
                entity.getEventType(),
                entity.getTopic(),
                readPayload(entity.getPayload()),
                entity.isSuccess(),
                entity.getErrorMessage(),
                entity.getLatencyMs(),
                entity.getCreatedAt()
        );
    }

    private String writePayload(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload == null ? Collections.emptyMap() : payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload is not serializable as JSON", e);
        }
    }

    private Map<String, Object> readPayload(String json) {
        try {
            return objectMapper.readValue(json, PAYLOAD_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Stored payload is not valid JSON, returning empty map: {}", e.getOriginalMessage());
            return Collections.emptyMap();
        }
    }
}
