package com.eryxon.gateway.infrastructure.web.dto;

import com.eryxon.gateway.domain.event.EventContext;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Data Transfer Object for a domain event submitted for broker dispatch.
 *
 * Contains:
 * - tenant_id: owning tenant (required)
 * - event_type: dot-delimited event type, e.g. "operation.started" (required)
 * - data: opaque event data, forwarded verbatim (required)
 * - context: optional plant-hierarchy values used for topic resolution
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class PublishEventRequest {

    @NotBlank(message = "tenant_id is required")
    @JsonProperty("tenant_id")
    private String tenantId;

    @NotBlank(message = "event_type is required")
    @JsonProperty("event_type")
    private String eventType;

    @NotNull(message = "data is required")
    private Map<String, Object> data;

    private EventContext context;
}
