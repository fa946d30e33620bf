package com.eryxon.gateway.infrastructure.transport;

import com.eryxon.gateway.application.port.BrokerTransport;
import com.eryxon.gateway.domain.model.BrokerConfig;
import com.eryxon.gateway.domain.model.PublishOutcome;
import com.eryxon.gateway.infrastructure.config.GatewayProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Publishes to MQTT brokers through their HTTP publish APIs.
 *
 * No native MQTT client is used. Instead the broker host is expanded into vendor-specific REST
 * endpoints (HiveMQ, EMQX, generic proxy) which are tried in order until one answers 2xx.
 * Each candidate is bounded by the RestTemplate's connect/read timeouts and is never retried.
 *
 * Features:
 * - HTTP Basic authentication from the broker's username/password
 * - Failure message lists every candidate and why it was rejected
 * - Latency is measured across all candidates
 */
@Slf4j
@Component
public class HttpBridgeBrokerTransport implements BrokerTransport {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final GatewayProperties.Transport settings;

    public HttpBridgeBrokerTransport(
            @Qualifier("brokerRestTemplate") RestTemplate restTemplate,
            ObjectMapper objectMapper,
            GatewayProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.settings = properties.getTransport();
    }

    @Override
    public PublishOutcome publish(BrokerConfig broker, String topic, Map<String, Object> payload) {
        if (broker == null) {
            throw new IllegalArgumentException("Broker cannot be null");
        }
        if (topic == null) {
            throw new IllegalArgumentException("Topic cannot be null");
        }

        long startedAt = System.nanoTime();

        List<EndpointCandidate> candidates = EndpointCandidate.forBroker(broker, settings);
        if (candidates.isEmpty()) {
            return PublishOutcome.failure(
                    "No publish endpoint configured for transport kind " + broker.getTransportKind(),
                    elapsedMs(startedAt));
        }

        HttpEntity<String> request;
        try {
            request = buildRequest(broker, topic, payload);
        } catch (JsonProcessingException e) {
            log.error("Payload serialization failed: brokerId={}, topic={}", broker.getId(), topic, e);
            return PublishOutcome.failure("Payload could not be serialized: " + e.getOriginalMessage(),
                    elapsedMs(startedAt));
        }

        List<String> rejections = new ArrayList<>(candidates.size());
        for (EndpointCandidate candidate : candidates) {
            String rejection = tryCandidate(candidate, request);
            if (rejection == null) {
                long latencyMs = elapsedMs(startedAt);
                log.info("Published to broker: brokerId={}, endpoint={}, topic={}, latencyMs={}",
                        broker.getId(), candidate.getKind(), topic, latencyMs);
                return PublishOutcome.success(latencyMs);
            }
            log.debug("Endpoint candidate rejected: brokerId={}, url={}, reason={}",
                    broker.getId(), candidate.getUrl(), rejection);
            rejections.add(candidate.getKind() + " " + candidate.getUrl() + " -> " + rejection);
        }

        return PublishOutcome.failure(
                "No HTTP publish endpoint accepted the message (" + candidates.size() + " tried): "
                        + String.join("; ", rejections),
                elapsedMs(startedAt));
    }

    private HttpEntity<String> buildRequest(BrokerConfig broker, String topic, Map<String, Object> payload)
            throws JsonProcessingException {
        BridgePublishRequest body = new BridgePublishRequest(
                topic,
                objectMapper.writeValueAsString(payload),
                settings.getQos(),
                settings.isRetain()
        );

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (broker.hasCredentials()) {
            headers.setBasicAuth(broker.getUsername(), broker.getPassword(), StandardCharsets.UTF_8);
        }
        return new HttpEntity<>(objectMapper.writeValueAsString(body), headers);
    }

    /**
     * @return null when the endpoint accepted the message, otherwise a short reason
     */
    private String tryCandidate(EndpointCandidate candidate, HttpEntity<String> request) {
        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    candidate.getUrl(), HttpMethod.POST, request, String.class);
            if (response.getStatusCode().is2xxSuccessful()) {
                return null;
            }
            return "HTTP " + response.getStatusCode().value();
        } catch (HttpStatusCodeException e) {
            return "HTTP " + e.getStatusCode().value();
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                return "timed out after " + settings.getCandidateTimeout().toMillis() + " ms";
            }
            return "connection failed: " + rootMessage(e);
        } catch (RestClientException e) {
            return "request failed: " + rootMessage(e);
        }
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }

    private static long elapsedMs(long startedAt) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
    }
}
