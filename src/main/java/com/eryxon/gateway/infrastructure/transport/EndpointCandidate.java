package com.eryxon.gateway.infrastructure.transport;

import com.eryxon.gateway.domain.model.BrokerConfig;
import com.eryxon.gateway.domain.model.TransportKind;
import com.eryxon.gateway.infrastructure.config.GatewayProperties;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * One concrete URL to try when publishing to a broker, tagged with the vendor convention it follows.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class EndpointCandidate {

    private static final Pattern SCHEME_PREFIX = Pattern.compile("^(mqtt|ws)s?://", Pattern.CASE_INSENSITIVE);
    private static final Pattern PORT_SUFFIX = Pattern.compile(":\\d+$");

    private final TransportKind kind;
    private final String url;

    public EndpointCandidate(TransportKind kind, String url) {
        this.kind = kind;
        this.url = url;
    }

    /**
     * Expands the configured endpoint templates for a broker.
     * A broker pinned to one transport kind only gets that vendor's endpoint; {@code AUTO}
     * gets every configured endpoint in configuration order.
     *
     * @param broker the target broker
     * @param settings transport settings holding the endpoint templates
     * @return candidates in the order they should be tried
     */
    public static List<EndpointCandidate> forBroker(BrokerConfig broker, GatewayProperties.Transport settings) {
        String scheme = broker.isUseTls() || !settings.isPlainHttpWhenTlsDisabled() ? "https" : "http";
        String host = bareHost(broker.getHost());

        return settings.getEndpoints().stream()
                .filter(endpoint -> broker.getTransportKind() == TransportKind.AUTO
                        || endpoint.getKind() == broker.getTransportKind())
                .map(endpoint -> new EndpointCandidate(endpoint.getKind(), endpoint.getUrlTemplate()
                        .replace("{scheme}", scheme)
                        .replace("{host}", host)
                        .replace("{port}", String.valueOf(broker.getPort()))))
                .collect(Collectors.toList());
    }

    /**
     * Strips an mqtt://, mqtts://, ws:// or wss:// prefix and a trailing :port from a broker URL.
     */
    static String bareHost(String brokerUrl) {
        if (brokerUrl == null) {
            return "";
        }
        String withoutScheme = SCHEME_PREFIX.matcher(brokerUrl.trim()).replaceFirst("");
        return PORT_SUFFIX.matcher(withoutScheme).replaceFirst("");
    }
}
