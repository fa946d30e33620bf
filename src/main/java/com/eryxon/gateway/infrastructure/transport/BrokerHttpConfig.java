package com.eryxon.gateway.infrastructure.transport;

import com.eryxon.gateway.infrastructure.config.GatewayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HTTP client used to reach broker publish APIs.
 *
 * Connect and read timeouts share the per-candidate timeout, so one candidate never takes
 * longer than that budget to connect and get its response.
 */
@Slf4j
@Configuration
public class BrokerHttpConfig {

    @Bean
    public RestTemplate brokerRestTemplate(GatewayProperties properties) {
        Duration candidateTimeout = properties.getTransport().getCandidateTimeout();
        int connectTimeoutMs = connectTimeoutMs(candidateTimeout);
        int readTimeoutMs = (int) Math.max(1, candidateTimeout.toMillis() - connectTimeoutMs);

        warnIfBrokerTimeoutTooShort(properties);

        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeoutMs);
        factory.setReadTimeout(readTimeoutMs);
        return new RestTemplate(factory);
    }

    /**
     * @return half of the candidate budget, at least 1 ms
     */
    static int connectTimeoutMs(Duration candidateTimeout) {
        return (int) Math.max(1, candidateTimeout.toMillis() / 2);
    }

    /**
     * @return the longest a broker's HTTP transport can run when every candidate uses its full budget
     */
    static Duration worstCaseDelivery(GatewayProperties properties) {
        GatewayProperties.Transport transport = properties.getTransport();
        return transport.getCandidateTimeout().multipliedBy(Math.max(1, transport.getEndpoints().size()));
    }

    private static void warnIfBrokerTimeoutTooShort(GatewayProperties properties) {
        Duration brokerTimeout = properties.getDispatch().getBrokerTimeout();
        Duration worstCase = worstCaseDelivery(properties);
        if (brokerTimeout.compareTo(worstCase) < 0) {
            log.warn("gateway.dispatch.broker-timeout ({} ms) is shorter than all endpoint candidates together ({} ms); "
                            + "slow brokers will report a delivery timeout instead of per-candidate errors",
                    brokerTimeout.toMillis(), worstCase.toMillis());
        }
    }
}
