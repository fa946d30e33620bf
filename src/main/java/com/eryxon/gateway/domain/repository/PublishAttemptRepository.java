package com.eryxon.gateway.domain.repository;

import com.eryxon.gateway.domain.model.PublishAttempt;

import java.util.List;
import java.util.UUID;

/**
 * Append-only sink for delivery attempts.
 * There is deliberately no update or delete operation.
 */
public interface PublishAttemptRepository {

    /**
     * Appends one attempt.
     *
     * @param attempt the attempt to store
     * @return the stored attempt with id and creation time assigned
     * @throws IllegalArgumentException if attempt is null
     */
    PublishAttempt append(PublishAttempt attempt);

    /**
     * Returns the latest attempts of a broker, newest first.
     *
     * @param brokerId the broker
     * @param limit maximum number of attempts to return
     */
    List<PublishAttempt> findRecentByBroker(UUID brokerId, int limit);
}
