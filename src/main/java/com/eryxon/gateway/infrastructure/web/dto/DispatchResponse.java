package com.eryxon.gateway.infrastructure.web.dto;

import com.eryxon.gateway.application.command.DispatchResult;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Response body of a dispatch call.
 * {@code success} is always true: per-broker failures are reported in {@code results}.
 */
@Getter
@AllArgsConstructor
public class DispatchResponse {

    private final boolean success;
    private final String message;
    private final int published;
    private final int failed;
    private final List<BrokerResultResponse> results;

    public static DispatchResponse from(DispatchResult result) {
        return new DispatchResponse(
                true,
                result.getMessage(),
                result.getPublished(),
                result.getFailed(),
                result.getResults().stream()
                        .map(BrokerResultResponse::from)
                        .collect(Collectors.toList())
        );
    }
}
