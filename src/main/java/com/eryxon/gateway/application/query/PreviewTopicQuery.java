package com.eryxon.gateway.application.query;

import com.eryxon.gateway.domain.event.EventContext;
import com.eryxon.gateway.domain.model.HierarchyDefaults;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Query that resolves a topic pattern against sample event values without dispatching anything.
 */
@Getter
@AllArgsConstructor
public class PreviewTopicQuery {

    private final String pattern;
    private final String eventType;
    private final String tenantId;
    private final EventContext context;
    private final HierarchyDefaults defaults;
}
