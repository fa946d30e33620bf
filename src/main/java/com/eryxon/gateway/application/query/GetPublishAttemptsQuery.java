package com.eryxon.gateway.application.query;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.UUID;

/**
 * Query for the most recent publish attempts of one broker.
 */
@Getter
@AllArgsConstructor
public class GetPublishAttemptsQuery {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 500;

    private final UUID brokerId;

    /**
     * Maximum number of attempts to return, 1..{@value #MAX_LIMIT}.
     */
    private final int limit;
}
