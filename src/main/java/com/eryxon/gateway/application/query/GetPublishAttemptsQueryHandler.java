package com.eryxon.gateway.application.query;

import com.eryxon.gateway.domain.exception.BrokerNotFoundException;
import com.eryxon.gateway.domain.exception.ValidationException;
import com.eryxon.gateway.domain.repository.BrokerConfigRepository;
import com.eryxon.gateway.domain.repository.PublishAttemptRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Query handler for a broker's publish audit log, newest first.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GetPublishAttemptsQueryHandler {

    private final BrokerConfigRepository brokerConfigRepository;
    private final PublishAttemptRepository attemptRepository;

    /**
     * @param query broker id and page size
     * @return latest attempts of the broker, possibly empty
     * @throws ValidationException if the limit is outside 1..500
     * @throws BrokerNotFoundException if no broker has the given id
     */
    public List<PublishAttemptResponse> handle(GetPublishAttemptsQuery query) {
        if (query.getBrokerId() == null) {
            throw new ValidationException("broker_id is required");
        }
        if (query.getLimit() < 1 || query.getLimit() > GetPublishAttemptsQuery.MAX_LIMIT) {
            throw new ValidationException("limit must be between 1 and " + GetPublishAttemptsQuery.MAX_LIMIT);
        }

        brokerConfigRepository.findById(query.getBrokerId())
                .orElseThrow(() -> new BrokerNotFoundException(query.getBrokerId()));

        List<PublishAttemptResponse> attempts = attemptRepository
                .findRecentByBroker(query.getBrokerId(), query.getLimit()).stream()
                .map(attempt -> new PublishAttemptResponse(
                        attempt.getId(),
                        attempt.getBrokerId(),
                        attempt.getEventType(),
                        attempt.getTopic(),
                        attempt.getPayload(),
                        attempt.isSuccess(),
                        attempt.getErrorMessage(),
                        attempt.getLatencyMs(),
                        attempt.getCreatedAt()
                ))
                .collect(Collectors.toList());

        log.debug("Retrieved {} publish attempts for broker {}", attempts.size(), query.getBrokerId());
        return attempts;
    }
}
