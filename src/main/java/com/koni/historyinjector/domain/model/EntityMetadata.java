package com.koni.historyinjector.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Maps an entity id to the internal identifier the target store uses for it.
 * Instances are immutable and cached by the entity resolver for the process lifetime.
 */
@Getter
@EqualsAndHashCode
public class EntityMetadata {

    /**
     * How the entity came to be known.
     */
    public enum Origin {
        EXISTING,
        API_CREATED
    }

    private final String entityId;
    private final long internalId;
    private final Origin origin;

    public EntityMetadata(String entityId, long internalId, Origin origin) {
        this.entityId = entityId;
        this.internalId = internalId;
        this.origin = origin;
    }

    @Override
    public String toString() {
        return "EntityMetadata{" +
                "entityId='" + entityId + '\'' +
                ", internalId=" + internalId +
                ", origin=" + origin +
                '}';
    }
}
