package com.eryxon.gateway.infrastructure.web.dto;

import com.eryxon.gateway.domain.event.EventContext;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Sample values for resolving a topic pattern without dispatching.
 * A missing pattern previews the default pattern.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class TopicPreviewRequest {

    private String pattern;

    @NotBlank(message = "event_type is required")
    @JsonProperty("event_type")
    private String eventType;

    @JsonProperty("tenant_id")
    private String tenantId;

    private EventContext context;

    private Defaults defaults;

    /**
     * Broker-level enterprise/site/area fallbacks.
     */
    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Defaults {
        private String enterprise;
        private String site;
        private String area;
    }
}
