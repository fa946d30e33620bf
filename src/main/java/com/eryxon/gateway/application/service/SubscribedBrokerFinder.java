package com.eryxon.gateway.application.service;

import com.eryxon.gateway.domain.model.BrokerConfig;
import com.eryxon.gateway.domain.repository.BrokerConfigRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Selects the brokers an event should go to: active brokers of the event's tenant whose
 * subscription set contains the event type. Brokers of other tenants are never considered.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SubscribedBrokerFinder {

    private final BrokerConfigRepository brokerConfigRepository;

    /**
     * @param tenantId the tenant that produced the event
     * @param eventType the event type, matched exactly against each broker's subscriptions
     * @return matching brokers; empty when the tenant has none or none subscribed
     */
    public List<BrokerConfig> findSubscribed(String tenantId, String eventType) {
        List<BrokerConfig> active = brokerConfigRepository.findActiveByTenant(tenantId);

        List<BrokerConfig> subscribed = active.stream()
                .filter(broker -> tenantId.equals(broker.getTenantId()))
                .filter(broker -> broker.isSubscribedTo(eventType))
                .collect(Collectors.toList());

        log.debug("Broker lookup: tenantId={}, eventType={}, active={}, subscribed={}",
                tenantId, eventType, active.size(), subscribed.size());

        return subscribed;
    }
}
