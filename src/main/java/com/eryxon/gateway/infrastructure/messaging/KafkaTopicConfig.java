package com.eryxon.gateway.infrastructure.messaging;

import com.eryxon.gateway.infrastructure.config.GatewayProperties;
import lombok.RequiredArgsConstructor;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the inbound domain event topic and its dead letter topic.
 * Both are created on startup if missing.
 */
@Configuration
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "gateway.kafka", name = "enabled", havingValue = "true")
public class KafkaTopicConfig {

    private final GatewayProperties properties;

    @Bean
    public NewTopic domainEventsTopic() {
        GatewayProperties.Kafka kafka = properties.getKafka();
        return TopicBuilder.name(kafka.getInboundTopic())
                .partitions(kafka.getPartitions())
                .replicas(kafka.getReplicationFactor())
                .build();
    }

    @Bean
    public NewTopic domainEventsDlqTopic() {
        GatewayProperties.Kafka kafka = properties.getKafka();
        return TopicBuilder.name(kafka.getInboundTopic() + KafkaErrorHandlingConfig.DLQ_SUFFIX)
                .partitions(1)
                .replicas(kafka.getReplicationFactor())
                .build();
    }
}
