package com.eryxon.gateway.infrastructure.persistence.entity;

import com.eryxon.gateway.domain.model.TransportKind;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * JPA entity for a tenant's broker configuration.
 * Rows are maintained by tenant administration; the gateway reads them and only writes
 * {@code last_connected_at} and {@code last_error}.
 */
@Entity
@Table(
    name = "broker_configs",
    indexes = {
        @Index(name = "idx_broker_configs_tenant_active", columnList = "tenant_id, active")
    }
)
@Getter
@Setter
@NoArgsConstructor
public class BrokerConfigEntity {

    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "broker_url", nullable = false)
    private String brokerUrl;

    @Column(name = "port", nullable = false)
    private int port;

    @Column(name = "username")
    private String username;

    @Column(name = "password")
    private String password;

    @Column(name = "topic_pattern")
    private String topicPattern;

    @Column(name = "default_enterprise")
    private String defaultEnterprise;

    @Column(name = "default_site")
    private String defaultSite;

    @Column(name = "default_area")
    private String defaultArea;

    @Column(name = "use_tls", nullable = false)
    private boolean useTls;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(
        name = "broker_subscribed_events",
        joinColumns = @JoinColumn(name = "broker_id")
    )
    @Column(name = "event_type", nullable = false)
    private Set<String> subscribedEvents = new LinkedHashSet<>();

    @Column(name = "active", nullable = false)
    private boolean active;

    @Enumerated(EnumType.STRING)
    @Column(name = "transport_kind", nullable = false, length = 32)
    private TransportKind transportKind = TransportKind.AUTO;

    @Column(name = "last_connected_at")
    private Instant lastConnectedAt;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

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
        if (transportKind == null) {
            transportKind = TransportKind.AUTO;
        }
    }
}
