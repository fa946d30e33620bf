package com.eryxon.gateway.infrastructure.web.controller;

import com.eryxon.gateway.application.command.DispatchEventCommand;
import com.eryxon.gateway.application.command.DispatchEventCommandHandler;
import com.eryxon.gateway.application.command.DispatchResult;
import com.eryxon.gateway.infrastructure.web.dto.DispatchResponse;
import com.eryxon.gateway.infrastructure.web.dto.PublishEventRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for event dispatch.
 * This controller handles the command side (write path) of the gateway.
 *
 * Endpoints:
 * - POST /api/v1/events/publish: Fan a domain event out to the tenant's subscribed brokers
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class EventDispatchController {

    private final DispatchEventCommandHandler commandHandler;

    /**
     * Dispatches a domain event and waits for every subscribed broker's outcome.
     *
     * Example request:
     * POST /api/v1/events/publish
     * {
     *   "tenant_id": "t-42",
     *   "event_type": "operation.started",
     *   "data": {"operation_id": "op-1"},
     *   "context": {"site": "Plant A", "cell": "Cell 3"}
     * }
     *
     * @param request the event to dispatch
     * @return 200 OK with per-broker results, even when some or all deliveries failed
     */
    @PostMapping("/v1/events/publish")
    public ResponseEntity<DispatchResponse> publish(@RequestBody @Valid PublishEventRequest request) {
        log.info("Received event: tenantId={}, eventType={}", request.getTenantId(), request.getEventType());

        DispatchEventCommand command = new DispatchEventCommand(
                request.getTenantId(),
                request.getEventType(),
                request.getData(),
                request.getContext()
        );

        DispatchResult result = commandHandler.handle(command);

        return ResponseEntity.ok(DispatchResponse.from(result));
    }
}
