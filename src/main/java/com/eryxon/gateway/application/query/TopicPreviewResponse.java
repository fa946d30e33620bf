package com.eryxon.gateway.application.query;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
public class TopicPreviewResponse {

    private final String topic;

    @JsonProperty("unknown_placeholders")
    private final List<String> unknownPlaceholders;
}
