package com.eryxon.gateway.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the publish attempt log.
 * Rows are inserted once and never updated; Hibernate ignores changes to loaded instances.
 */
@Entity
@Immutable
@Table(
    name = "publish_attempts",
    indexes = {
        @Index(name = "idx_publish_attempts_broker_created", columnList = "broker_id, created_at DESC")
    }
)
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class PublishAttemptEntity {

    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "broker_id", nullable = false)
    private UUID brokerId;

    @Column(name = "event_type", nullable = false)
    private String eventType;

    @Column(name = "topic", nullable = false, columnDefinition = "TEXT")
    private String topic;

    /** Wire payload as JSON text. */
    @Column(name = "payload", nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Column(name = "success", nullable = false)
    private boolean success;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "latency_ms", nullable = false)
    private long latencyMs;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
