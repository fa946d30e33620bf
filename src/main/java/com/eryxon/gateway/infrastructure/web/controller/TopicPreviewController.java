package com.eryxon.gateway.infrastructure.web.controller;

import com.eryxon.gateway.application.query.PreviewTopicQuery;
import com.eryxon.gateway.application.query.PreviewTopicQueryHandler;
import com.eryxon.gateway.application.query.TopicPreviewResponse;
import com.eryxon.gateway.domain.model.HierarchyDefaults;
import com.eryxon.gateway.infrastructure.web.dto.TopicPreviewRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for checking topic patterns before saving them on a broker.
 *
 * Endpoints:
 * - POST /api/v1/topics/preview: Resolve a pattern against sample event values
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class TopicPreviewController {

    private final PreviewTopicQueryHandler queryHandler;

    @PostMapping("/v1/topics/preview")
    public ResponseEntity<TopicPreviewResponse> preview(@RequestBody @Valid TopicPreviewRequest request) {
        TopicPreviewRequest.Defaults defaults = request.getDefaults();

        PreviewTopicQuery query = new PreviewTopicQuery(
                request.getPattern(),
                request.getEventType(),
                request.getTenantId(),
                request.getContext(),
                defaults == null
                        ? HierarchyDefaults.none()
                        : new HierarchyDefaults(defaults.getEnterprise(), defaults.getSite(), defaults.getArea())
        );

        return ResponseEntity.ok(queryHandler.handle(query));
    }
}
