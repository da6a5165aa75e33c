package com.koni.historyinjector.infrastructure.web.dto;

import com.koni.historyinjector.domain.model.EntityMetadata;
import lombok.Getter;

/**
 * DTO for a cached entity returned by the admin API.
 */
@Getter
public class EntityResponse {

    private final String entityId;
    private final long metadataId;
    private final String origin;

    public EntityResponse(String entityId, long metadataId, String origin) {
        this.entityId = entityId;
        this.metadataId = metadataId;
        this.origin = origin;
    }

    public static EntityResponse from(EntityMetadata metadata) {
        return new EntityResponse(metadata.getEntityId(), metadata.getInternalId(), metadata.getOrigin().name());
    }
}
