package com.eryxon.gateway.application.command;

import com.eryxon.gateway.domain.event.EventContext;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Map;

/**
 * Command to fan one domain event out to every broker of its tenant that subscribed to it.
 */
@Getter
@AllArgsConstructor
public class DispatchEventCommand {

    private final String tenantId;

    /**
     * Dot-delimited event type, e.g. "operation.started".
     */
    private final String eventType;

    /**
     * Opaque event data, forwarded verbatim.
     */
    private final Map<String, Object> data;

    /**
     * Optional plant-hierarchy context used for topic resolution.
     */
    private final EventContext context;
}
