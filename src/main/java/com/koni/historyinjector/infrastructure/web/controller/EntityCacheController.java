package com.koni.historyinjector.infrastructure.web.controller;

import com.koni.historyinjector.application.ingest.EntityResolver;
import com.koni.historyinjector.domain.exception.ValidationException;
import com.koni.historyinjector.domain.model.EntityIds;
import com.koni.historyinjector.infrastructure.web.dto.EntityResponse;
import com.koni.historyinjector.infrastructure.web.dto.RefreshResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Admin endpoints for the entity resolution cache.
 *
 * Endpoints:
 * - GET /api/v1/entities: entities resolved since startup
 * - POST /api/v1/entities/refresh: drop the whole cache
 * - POST /api/v1/entities/{entityId}/refresh: drop one entity, e.g. after it was renamed or
 *   removed in Home Assistant
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class EntityCacheController {

    private final EntityResolver entityResolver;

    @GetMapping("/v1/entities")
    public ResponseEntity<List<EntityResponse>> getEntities() {
        List<EntityResponse> entities = entityResolver.cachedEntities().stream()
                .map(EntityResponse::from)
                .collect(Collectors.toList());
        log.info("Returning {} cached entities", entities.size());
        return ResponseEntity.ok(entities);
    }

    @PostMapping("/v1/entities/refresh")
    public ResponseEntity<RefreshResponse> refreshAll() {
        log.info("Received request to clear the entity cache");
        return ResponseEntity.ok(new RefreshResponse(entityResolver.refreshAll()));
    }

    @PostMapping("/v1/entities/{entityId}/refresh")
    public ResponseEntity<RefreshResponse> refresh(@PathVariable String entityId) {
        if (!EntityIds.isValid(entityId)) {
            throw new ValidationException("Invalid entity id '" + entityId + "'");
        }
        log.info("Received request to refresh entity {}", entityId);
        return ResponseEntity.ok(new RefreshResponse(entityResolver.refresh(entityId) ? 1 : 0));
    }
}
