package com.eryxon.gateway.infrastructure.config;

import com.eryxon.gateway.domain.model.TransportKind;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings under the {@code gateway.*} prefix.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    private final Dispatch dispatch = new Dispatch();
    private final Transport transport = new Transport();
    private final Health health = new Health();
    private final Kafka kafka = new Kafka();

    @Getter
    @Setter
    public static class Dispatch {

        /** Upper bound for one broker's delivery, all endpoint candidates included. */
        private Duration brokerTimeout = Duration.ofSeconds(20);

        private int corePoolSize = 8;
        private int maxPoolSize = 32;
        private int queueCapacity = 500;
    }

    @Getter
    @Setter
    public static class Transport {

        /** Budget for one endpoint candidate, split between connecting and reading the response. */
        private Duration candidateTimeout = Duration.ofSeconds(5);

        private int qos = 1;
        private boolean retain = false;

        /** Use http:// instead of https:// for brokers that have TLS turned off. */
        private boolean plainHttpWhenTlsDisabled = false;

        /** Endpoint candidates in probe order. Templates may use {scheme}, {host} and {port}. */
        private List<Endpoint> endpoints = new ArrayList<>(List.of(
                new Endpoint(TransportKind.HIVEMQ, "{scheme}://{host}:8443/api/v1/mqtt/publish"),
                new Endpoint(TransportKind.EMQX, "{scheme}://{host}:8081/api/v5/publish"),
                new Endpoint(TransportKind.GENERIC_REST, "{scheme}://{host}/api/mqtt/publish")
        ));

        private final CircuitBreaker circuitBreaker = new CircuitBreaker();
    }

    @Getter
    @Setter
    public static class Endpoint {

        private TransportKind kind;
        private String urlTemplate;

        public Endpoint() {
        }

        public Endpoint(TransportKind kind, String urlTemplate) {
            this.kind = kind;
            this.urlTemplate = urlTemplate;
        }
    }

    @Getter
    @Setter
    public static class CircuitBreaker {

        /** Off by default: an open breaker skips the delivery attempt instead of making it. */
        private boolean enabled = false;
        private int slidingWindowSize = 10;
        private float failureRateThreshold = 50.0f;
        private Duration waitDurationInOpenState = Duration.ofSeconds(30);
        private int permittedCallsInHalfOpenState = 1;
    }

    @Getter
    @Setter
    public static class Health {

        /** Number of recent attempts the derived broker health is computed from. */
        private int sampleSize = 10;
    }

    @Getter
    @Setter
    public static class Kafka {

        private boolean enabled = false;
        private String inboundTopic = "mes.domain-events";
        private int partitions = 3;
        private short replicationFactor = 1;
    }
}
