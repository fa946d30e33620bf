package com.eryxon.gateway.infrastructure.web.controller;

import com.eryxon.gateway.application.query.BrokerHealthResponse;
import com.eryxon.gateway.application.query.GetBrokerHealthQuery;
import com.eryxon.gateway.application.query.GetBrokerHealthQueryHandler;
import com.eryxon.gateway.application.query.GetPublishAttemptsQuery;
import com.eryxon.gateway.application.query.GetPublishAttemptsQueryHandler;
import com.eryxon.gateway.application.query.PublishAttemptResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for broker diagnostics.
 *
 * Endpoints:
 * - GET /api/v1/tenants/{tenantId}/brokers/health: Derived health of each broker of a tenant
 * - GET /api/v1/brokers/{brokerId}/attempts: Publish audit log of one broker, newest first
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class BrokerController {

    private final GetBrokerHealthQueryHandler healthQueryHandler;
    private final GetPublishAttemptsQueryHandler attemptsQueryHandler;

    @GetMapping("/v1/tenants/{tenantId}/brokers/health")
    public ResponseEntity<List<BrokerHealthResponse>> getBrokerHealth(@PathVariable String tenantId) {
        log.info("Received broker health request: tenantId={}", tenantId);

        List<BrokerHealthResponse> health = healthQueryHandler.handle(new GetBrokerHealthQuery(tenantId));

        return ResponseEntity.ok(health);
    }

    /**
     * @param brokerId the broker
     * @param limit maximum number of attempts, 1..500
     * @return 200 OK with the attempts, 404 if the broker does not exist
     */
    @GetMapping("/v1/brokers/{brokerId}/attempts")
    public ResponseEntity<List<PublishAttemptResponse>> getAttempts(
            @PathVariable UUID brokerId,
            @RequestParam(defaultValue = "" + GetPublishAttemptsQuery.DEFAULT_LIMIT) int limit) {
        log.info("Received attempt log request: brokerId={}, limit={}", brokerId, limit);

        List<PublishAttemptResponse> attempts =
                attemptsQueryHandler.handle(new GetPublishAttemptsQuery(brokerId, limit));

        return ResponseEntity.ok(attempts);
    }
}
