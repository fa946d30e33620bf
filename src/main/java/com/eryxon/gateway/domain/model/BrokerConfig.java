package com.eryxon.gateway.domain.model;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * A tenant's configured publish target.
 * The gateway treats everything here as read-only configuration except the two health fields
 * {@code lastConnectedAt} and {@code lastError}, which are written by the outcome recorder.
 */
@Getter
public class BrokerConfig {

    public static final String DEFAULT_TOPIC_PATTERN = "{enterprise}/{site}/{area}/{cell}/{event}";

    private final UUID id;
    private final String tenantId;
    private final String name;
    private final String host;
    private final int port;
    private final String username;
    private final String password;
    private final String topicPattern;
    private final HierarchyDefaults defaults;
    private final boolean useTls;
    private final Set<String> subscribedEvents;
    private final boolean active;
    private final TransportKind transportKind;
    private final Instant lastConnectedAt;
    private final String lastError;

    @Builder
    public BrokerConfig(UUID id, String tenantId, String name, String host, int port,
                        String username, String password, String topicPattern,
                        HierarchyDefaults defaults, boolean useTls, Set<String> subscribedEvents,
                        boolean active, TransportKind transportKind,
                        Instant lastConnectedAt, String lastError) {
        this.id = id;
        this.tenantId = tenantId;
        this.name = name;
        this.host = host;
        this.port = port;
        this.username = username;
        this.password = password;
        this.topicPattern = topicPattern == null || topicPattern.isBlank() ? DEFAULT_TOPIC_PATTERN : topicPattern;
        this.defaults = defaults == null ? HierarchyDefaults.none() : defaults;
        this.useTls = useTls;
        this.subscribedEvents = subscribedEvents == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(subscribedEvents));
        this.active = active;
        this.transportKind = transportKind == null ? TransportKind.AUTO : transportKind;
        this.lastConnectedAt = lastConnectedAt;
        this.lastError = lastError;
    }

    /**
     * @return true if this broker has asked for events of the given type
     */
    public boolean isSubscribedTo(String eventType) {
        return subscribedEvents.contains(eventType);
    }

    /**
     * @return true if both halves of the credential pair are present
     */
    public boolean hasCredentials() {
        return username != null && !username.isEmpty() && password != null && !password.isEmpty();
    }

    @Override
    public String toString() {
        return "BrokerConfig{" +
                "id=" + id +
                ", tenantId=" + tenantId +
                ", name=" + name +
                ", host=" + host +
                ", port=" + port +
                ", transportKind=" + transportKind +
                ", active=" + active +
                '}';
    }
}
