package com.eryxon.gateway.infrastructure.messaging;

import com.eryxon.gateway.domain.exception.ValidationException;
import com.eryxon.gateway.infrastructure.config.GatewayProperties;
import com.eryxon.gateway.infrastructure.observability.GatewayMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.common.TopicPartition;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.CommonErrorHandler;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.ExponentialBackOff;

import java.nio.charset.StandardCharsets;

/**
 * Kafka error handling for the inbound domain event topic.
 *
 * Error handling flow:
 * - Invalid envelopes (ValidationException) go to the DLQ immediately
 * - Other failures retry with exponential backoff (1s, 2s, 4s), at most 3 retries
 * - Records that still fail go to {@code <inbound-topic>.dlq}
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "gateway.kafka", name = "enabled", havingValue = "true")
public class KafkaErrorHandlingConfig {

    static final String DLQ_SUFFIX = ".dlq";
    private static final long INITIAL_INTERVAL = 1000L;
    private static final double MULTIPLIER = 2.0;
    private static final int MAX_ATTEMPTS = 3;

    private final GatewayMetrics metrics;
    private final GatewayProperties properties;

    /**
     * @param kafkaTemplate the Kafka template for publishing to the DLQ
     * @return DefaultErrorHandler with DLQ recovery
     */
    @Bean
    public CommonErrorHandler inboundErrorHandler(KafkaTemplate<?, ?> kafkaTemplate) {
        String dlqTopic = properties.getKafka().getInboundTopic() + DLQ_SUFFIX;

        DeadLetterPublishingRecoverer recoverer = new DeadLetterPublishingRecoverer(
                kafkaTemplate,
                (consumerRecord, exception) -> {
                    log.error("Sending domain event to DLQ: topic={}, key={}, dlq={}, error={}",
                            consumerRecord.topic(),
                            consumerRecord.key(),
                            dlqTopic,
                            exception.getMessage(),
                            exception);
                    metrics.recordDlqMessageSent();
                    return new TopicPartition(dlqTopic, -1);
                }
        );

        ExponentialBackOff backOff = new ExponentialBackOff(INITIAL_INTERVAL, MULTIPLIER);
        backOff.setMaxAttempts(MAX_ATTEMPTS);

        DefaultErrorHandler errorHandler = new DefaultErrorHandler(recoverer, backOff);
        errorHandler.addNotRetryableExceptions(ValidationException.class);

        errorHandler.setRetryListeners((consumerRecord, exception, deliveryAttempt) -> {
            log.warn("Retry attempt {} for domain event: topic={}, key={}, error={}",
                    deliveryAttempt,
                    consumerRecord.topic(),
                    consumerRecord.key(),
                    exception.getMessage());

            consumerRecord.headers().add("retry-count",
                    String.valueOf(deliveryAttempt).getBytes(StandardCharsets.UTF_8));
        });

        return errorHandler;
    }
}
