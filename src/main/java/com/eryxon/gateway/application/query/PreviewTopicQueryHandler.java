package com.eryxon.gateway.application.query;

import com.eryxon.gateway.domain.exception.ValidationException;
import com.eryxon.gateway.domain.model.BrokerConfig;
import com.eryxon.gateway.domain.naming.TopicPatternInspector;
import com.eryxon.gateway.domain.naming.TopicResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves a topic pattern the same way dispatch does and reports placeholders the resolver
 * does not know. Unknown placeholders still resolve to empty segments, as in a real dispatch.
 */
@Slf4j
@Service
public class PreviewTopicQueryHandler {

    /**
     * @param query pattern and sample event values; a blank pattern means the default pattern
     * @return the resolved topic and any unknown placeholder names, in pattern order
     * @throws ValidationException if the event type is blank
     */
    public TopicPreviewResponse handle(PreviewTopicQuery query) {
        if (query.getEventType() == null || query.getEventType().isBlank()) {
            throw new ValidationException("event_type is required");
        }

        String pattern = query.getPattern() == null || query.getPattern().isBlank()
                ? BrokerConfig.DEFAULT_TOPIC_PATTERN
                : query.getPattern();

        String topic = TopicResolver.resolve(
                pattern,
                query.getContext(),
                query.getDefaults(),
                query.getEventType(),
                query.getTenantId()
        );
        List<String> unknown = new ArrayList<>(TopicPatternInspector.unknownPlaceholders(pattern));

        if (!unknown.isEmpty()) {
            log.debug("Topic pattern has unknown placeholders: pattern={}, unknown={}", pattern, unknown);
        }
        return new TopicPreviewResponse(topic, unknown);
    }
}
