package com.eryxon.gateway.domain.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Delivery health of a broker, derived at read time from its most recent attempts.
 * The stored {@code lastConnectedAt}/{@code lastError} fields are carried along for operators,
 * but the status itself depends only on the attempt log.
 */
@Getter
@AllArgsConstructor
@ToString
public final class BrokerHealth {

    public enum Status {
        HEALTHY,
        DEGRADED,
        UNKNOWN
    }

    private final UUID brokerId;
    private final Status status;
    private final int sampleSize;
    private final int successCount;
    private final Instant lastAttemptAt;
    private final Instant lastConnectedAt;
    private final String lastError;

    /**
     * Derives health from a broker and its recent attempts.
     *
     * @param broker the broker configuration
     * @param recentAttempts the broker's latest attempts, newest first
     * @return the derived health view
     */
    public static BrokerHealth from(BrokerConfig broker, List<PublishAttempt> recentAttempts) {
        if (recentAttempts.isEmpty()) {
            return new BrokerHealth(broker.getId(), Status.UNKNOWN, 0, 0, null,
                    broker.getLastConnectedAt(), broker.getLastError());
        }

        PublishAttempt latest = recentAttempts.get(0);
        int successes = (int) recentAttempts.stream().filter(PublishAttempt::isSuccess).count();
        Status status = latest.isSuccess() ? Status.HEALTHY : Status.DEGRADED;

        return new BrokerHealth(
                broker.getId(),
                status,
                recentAttempts.size(),
                successes,
                latest.getCreatedAt(),
                broker.getLastConnectedAt(),
                broker.getLastError()
        );
    }

    /**
     * @return share of successful attempts in the sample, 0.0 when there is no sample
     */
    public double getSuccessRate() {
        return sampleSize == 0 ? 0.0 : (double) successCount / sampleSize;
    }
}
